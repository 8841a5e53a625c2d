package com.dedicatedcode.kentta;

import com.dedicatedcode.kentta.config.KenttaConfiguration;
import com.dedicatedcode.kentta.service.GeoHelper;
import com.dedicatedcode.kentta.service.importer.ImportService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.junit.jupiter.api.Assertions.*;

@IntegrationTest
class KenttaApplicationTest {

    @Autowired
    private ImportService importService;

    @Autowired
    private GeoHelper geoHelper;

    @Autowired
    private KenttaConfiguration configuration;

    @Test
    void testContextLoads() {
        assertNotNull(importService);
        assertNotNull(geoHelper);
        assertFalse(importService.isCancelled());
    }

    @Test
    void testConfigurationBoundFromProperties() {
        assertEquals("./data", configuration.getDataDir());
        assertEquals("apt.dat", configuration.getImportConfiguration().getFileNamePattern());
        assertEquals(0, configuration.getImportConfiguration().getLengthPrecision());
        assertTrue(configuration.getImportConfiguration().isRecreateSchema());
        assertTrue(configuration.getFilterConfiguration().getIncludeAirports().isEmpty());
    }
}
