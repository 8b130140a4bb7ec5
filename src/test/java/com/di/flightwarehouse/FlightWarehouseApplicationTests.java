package com.di.flightwarehouse;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Basic smoke test for FlightWarehouseApplication.
 * A full context needs PostgreSQL and GCS credentials; the pipeline itself is covered
 * end to end by FlightPipelineOrchestratorTest over in-memory stores.
 */
@DisplayName("FlightWarehouseApplication Tests")
class FlightWarehouseApplicationTests {

	@Test
	@DisplayName("Should have main class")
	void testMainClassExists() {
		Class<?> mainClass = FlightWarehouseApplication.class;
		assertNotNull(mainClass);
		assertEquals("FlightWarehouseApplication", mainClass.getSimpleName());
	}

	@Test
	@DisplayName("Should have main method")
	void testMainMethodExists() throws NoSuchMethodException {
		var mainMethod = FlightWarehouseApplication.class.getMethod("main", String[].class);
		assertTrue(java.lang.reflect.Modifier.isStatic(mainMethod.getModifiers()));
		assertTrue(java.lang.reflect.Modifier.isPublic(mainMethod.getModifiers()));
	}
}
