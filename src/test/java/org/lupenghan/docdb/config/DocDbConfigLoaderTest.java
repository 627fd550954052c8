package org.lupenghan.docdb.config;

import org.junit.After;
import org.junit.Test;
import org.lupenghan.docdb.plan.models.PersistenceMode;

import java.nio.file.Paths;
import java.util.Properties;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class DocDbConfigLoaderTest {

    @After
    public void tearDown() {
        System.clearProperty(DocDbConfigLoader.SUPERUSER_ROLE);
    }

    @Test
    public void testEmptyPropertiesGiveDefaults() {
        DocDbConfig config = DocDbConfigLoader.fromProperties(new Properties());
        assertEquals(DocDbConfig.defaults(), config);
        assertEquals(Paths.get("data", "database.json"), config.getDatabasePath());
        assertEquals(PersistenceMode.PER_PLAN, config.getPersistenceMode());
        assertEquals(500, config.getHistoryLimit());
        assertTrue(config.isLockFileEnabled());
    }

    @Test
    public void testOverrides() {
        Properties properties = new Properties();
        properties.setProperty(DocDbConfigLoader.DATABASE_PATH, " /tmp/docdb/db.json ");
        properties.setProperty(DocDbConfigLoader.PERSISTENCE_MODE, "per-operation");
        properties.setProperty(DocDbConfigLoader.SUPERUSER_ROLE, "root");
        properties.setProperty(DocDbConfigLoader.HISTORY_PATH, "");
        properties.setProperty(DocDbConfigLoader.HISTORY_LIMIT, "50");
        properties.setProperty(DocDbConfigLoader.DIGEST_SAMPLE_ROWS, "0");
        properties.setProperty(DocDbConfigLoader.LOCK_FILE_ENABLED, "FALSE");

        DocDbConfig config = DocDbConfigLoader.fromProperties(properties);
        assertEquals(Paths.get("/tmp/docdb/db.json"), config.getDatabasePath());
        assertEquals(PersistenceMode.PER_OPERATION, config.getPersistenceMode());
        assertEquals("root", config.getSuperuserRole());
        assertNull(config.getHistoryPath());
        assertEquals(50, config.getHistoryLimit());
        assertEquals(0, config.getDigestSampleRows());
        assertFalse(config.isLockFileEnabled());
    }

    @Test
    public void testInvalidValuesFallBack() {
        Properties properties = new Properties();
        properties.setProperty(DocDbConfigLoader.PERSISTENCE_MODE, "sometimes");
        properties.setProperty(DocDbConfigLoader.HISTORY_LIMIT, "0");
        properties.setProperty(DocDbConfigLoader.DIGEST_SAMPLE_ROWS, "-3");
        properties.setProperty(DocDbConfigLoader.LOCK_FILE_ENABLED, "yes");

        DocDbConfig config = DocDbConfigLoader.fromProperties(properties);
        assertEquals(PersistenceMode.PER_PLAN, config.getPersistenceMode());
        assertEquals(500, config.getHistoryLimit());
        assertEquals(2, config.getDigestSampleRows());
        assertTrue(config.isLockFileEnabled());

        properties.setProperty(DocDbConfigLoader.HISTORY_LIMIT, "many");
        assertEquals(500, DocDbConfigLoader.fromProperties(properties).getHistoryLimit());
    }

    @Test
    public void testSystemPropertiesWin() {
        System.setProperty(DocDbConfigLoader.SUPERUSER_ROLE, "owner");
        DocDbConfig config = DocDbConfigLoader.load();
        assertEquals("owner", config.getSuperuserRole());
        assertEquals(Paths.get("data", "database.json"), config.getDatabasePath());
    }

    @Test
    public void testMissingResource() {
        assertTrue(DocDbConfigLoader.loadProperties("no-such-file.properties").isEmpty());
    }
}
