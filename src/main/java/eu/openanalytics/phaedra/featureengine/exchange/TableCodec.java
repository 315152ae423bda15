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
package eu.openanalytics.phaedra.featureengine.exchange;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import eu.openanalytics.phaedra.featureengine.exception.DataShapeException;
import eu.openanalytics.phaedra.featureengine.exception.FeatureEngineException;
import eu.openanalytics.phaedra.featureengine.framework.columntable.ColumnTable;

/**
 * Serializes tables to JSON, so that no object reference crosses an execution unit.
 *
 * Every value is written together with the name of its type, and read back as that same type:
 * a table decodes to a table equal to the encoded one. Values must be null, strings, booleans or
 * one of the {@link Number} types of the JDK.
 */
public class TableCodec {

	private static final String COLUMNS = "columns";
	private static final String NAME = "name";
	private static final String TYPES = "types";
	private static final String VALUES = "values";

	private final ObjectMapper objectMapper;

	public TableCodec(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	public byte[] encode(Object data) {
		if (!(data instanceof ColumnTable table)) {
			throw DataShapeException.of(data, ColumnTable.class, getClass());
		}

		ObjectNode root = objectMapper.createObjectNode();
		ArrayNode columns = root.putArray(COLUMNS);
		for (Map.Entry<String, List<Object>> entry : table.getColumns().entrySet()) {
			ObjectNode column = columns.addObject();
			column.put(NAME, entry.getKey());
			ArrayNode types = column.putArray(TYPES);
			ArrayNode values = column.putArray(VALUES);
			for (Object value : entry.getValue()) {
				ValueType type = ValueType.of(value, entry.getKey());
				types.add(type.name());
				values.add(type.write(value, objectMapper));
			}
		}

		try {
			return objectMapper.writeValueAsBytes(root);
		} catch (IOException e) {
			throw new FeatureEngineException("Failed to encode table", e);
		}
	}

	public ColumnTable decode(byte[] bytes) {
		try {
			JsonNode root = objectMapper.readTree(bytes);
			Map<String, List<Object>> columns = new LinkedHashMap<>();
			for (JsonNode column : root.path(COLUMNS)) {
				JsonNode types = column.path(TYPES);
				JsonNode values = column.path(VALUES);
				if (types.size() != values.size()) {
					throw new FeatureEngineException("Column %s has %d values but %d types", column.path(NAME).asText(), values.size(), types.size());
				}
				List<Object> decoded = new ArrayList<>(values.size());
				for (int i = 0; i < values.size(); i++) {
					decoded.add(ValueType.valueOf(types.get(i).asText()).read(values.get(i), objectMapper));
				}
				columns.put(column.path(NAME).asText(), decoded);
			}
			return new ColumnTable(columns);
		} catch (IOException | IllegalArgumentException e) {
			throw new FeatureEngineException("Failed to decode table", e);
		}
	}

	private enum ValueType {
		NULL(Void.class),
		STRING(String.class),
		BOOLEAN(Boolean.class),
		BYTE(Byte.class),
		SHORT(Short.class),
		INTEGER(Integer.class),
		LONG(Long.class),
		BIG_INTEGER(BigInteger.class),
		FLOAT(Float.class),
		DOUBLE(Double.class),
		// Written as text, JSON parsers read decimals as doubles.
		BIG_DECIMAL(BigDecimal.class);

		private final Class<?> javaType;

		ValueType(Class<?> javaType) {
			this.javaType = javaType;
		}

		static ValueType of(Object value, String column) {
			if (value == null) return NULL;
			for (ValueType type : values()) {
				if (type.javaType == value.getClass()) return type;
			}
			throw new DataShapeException("Column %s holds a value of type %s, which cannot be exchanged", column, value.getClass().getName());
		}

		JsonNode write(Object value, ObjectMapper objectMapper) {
			if (this == NULL) return NullNode.getInstance();
			if (this == BIG_DECIMAL) return TextNode.valueOf(((BigDecimal) value).toString());
			return objectMapper.valueToTree(value);
		}

		Object read(JsonNode node, ObjectMapper objectMapper) throws IOException {
			if (this == NULL) return null;
			if (this == BIG_DECIMAL) return new BigDecimal(node.asText());
			return objectMapper.treeToValue(node, javaType);
		}
	}
}
