/**
 * Phaedra II
 *
 * Copyright (C) 2016-2025 Open Analytics
 *
 * ===========================================================================
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the Apache License as published by
 * The Apache Software Foundation, either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * Apache License for more details.
 *
 * You should have received a copy of the Apache License
 * along with this program.  If not, see <http://www.apache.org/licenses/>
 */
package eu.openanalytics.phaedra.featureengine.plugin;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import eu.openanalytics.phaedra.featureengine.exception.DataShapeException;

/**
 * Statistics over the non-null values of a column.
 * All numeric statistics return null for a column without values.
 */
public final class ColumnStatistics {

	private ColumnStatistics() {
	}

	public static List<Double> numbers(String column, List<?> values) {
		List<Double> numbers = new ArrayList<>(values.size());
		for (Object value : values) {
			if (value == null) continue;
			if (!(value instanceof Number number)) {
				throw new DataShapeException("Column %s contains a non-numeric value: %s", column, value);
			}
			numbers.add(number.doubleValue());
		}
		return numbers;
	}

	public static Double sum(List<Double> numbers) {
		if (numbers.isEmpty()) return null;
		double sum = 0;
		for (double n : numbers) sum += n;
		return sum;
	}

	public static Double mean(List<Double> numbers) {
		if (numbers.isEmpty()) return null;
		return sum(numbers) / numbers.size();
	}

	/**
	 * Population variance.
	 */
	public static Double variance(List<Double> numbers) {
		if (numbers.isEmpty()) return null;
		double mean = mean(numbers);
		double squares = 0;
		for (double n : numbers) squares += (n - mean) * (n - mean);
		return squares / numbers.size();
	}

	public static Double std(List<Double> numbers) {
		Double variance = variance(numbers);
		return variance == null ? null : Math.sqrt(variance);
	}

	public static Double median(List<Double> numbers) {
		if (numbers.isEmpty()) return null;
		List<Double> sorted = new ArrayList<>(numbers);
		Collections.sort(sorted);
		int mid = sorted.size() / 2;
		if (sorted.size() % 2 == 1) return sorted.get(mid);
		return (sorted.get(mid - 1) + sorted.get(mid)) / 2;
	}

	/**
	 * The most frequent non-null value. On a tie, the value that was seen first wins.
	 */
	public static Object mode(List<?> values) {
		Map<Object, Integer> counts = new LinkedHashMap<>();
		for (Object value : values) {
			if (value != null) counts.merge(value, 1, Integer::sum);
		}
		Object mode = null;
		int best = 0;
		for (Map.Entry<Object, Integer> entry : counts.entrySet()) {
			if (entry.getValue() > best) {
				mode = entry.getKey();
				best = entry.getValue();
			}
		}
		return mode;
	}
}
