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
package eu.openanalytics.phaedra.featureengine;

import java.util.Arrays;
import java.util.EnumSet;

import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

import eu.openanalytics.phaedra.featureengine.config.FeatureEngineProperties;
import eu.openanalytics.phaedra.featureengine.enumeration.ParallelizationMode;
import eu.openanalytics.phaedra.featureengine.framework.ComputeFrameworkType;

@SpringBootApplication
public class FeatureEngineApplication {

	private static final String PREFIX = "phaedra.featureengine.";

	private final Environment environment;

	public FeatureEngineApplication(Environment environment) {
		this.environment = environment;
	}

	public static void main(String[] args) {
		SpringApplication.run(FeatureEngineApplication.class, args);
	}

	@Bean
	public FeatureEngineProperties featureEngineProperties() {
		FeatureEngineProperties properties = new FeatureEngineProperties();
		properties.setMode(ParallelizationMode.valueOf(environment.getProperty(PREFIX + "mode", "SYNC").trim().toUpperCase()));
		properties.setWorkerThreads(Integer.valueOf(environment.getProperty(PREFIX + "worker-threads", "4")));
		properties.setTimeCalculations(Boolean.parseBoolean(environment.getProperty(PREFIX + "time-calculations", "false")));

		String frameworks = environment.getProperty(PREFIX + "compute-frameworks");
		if (StringUtils.isNotBlank(frameworks)) {
			EnumSet<ComputeFrameworkType> types = EnumSet.noneOf(ComputeFrameworkType.class);
			Arrays.stream(StringUtils.split(frameworks, ", ")).map(ComputeFrameworkType::of).forEach(types::add);
			properties.setComputeFrameworks(types);
		}
		return properties;
	}
}
