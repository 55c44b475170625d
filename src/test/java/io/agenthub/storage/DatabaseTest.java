package io.agenthub.storage;

import io.agenthub.config.HubConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.Locale;
import java.util.stream.Stream;

final class DatabaseTest {

    @Test
    void initIsRepeatableAndRecordsEachMigrationOnce() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-database-");
        try {
            Database db = new Database(HubConfig.fromRoot(root.toString()));
            db.init();
            db.init();

            Assertions.assertTrue(Files.exists(root.resolve("agenthub.db")));
            Assertions.assertTrue(Files.isDirectory(root.resolve("audit")));
            try (Connection c = db.openConnection(); Statement st = c.createStatement()) {
                try (ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM schema_migrations WHERE success=1")) {
                    Assertions.assertTrue(rs.next());
                    Assertions.assertEquals(1, rs.getInt(1));
                }
                try (ResultSet rs = st.executeQuery("PRAGMA journal_mode")) {
                    Assertions.assertTrue(rs.next());
                    Assertions.assertEquals("wal", rs.getString(1).toLowerCase(Locale.ROOT));
                }
                try (ResultSet rs = st.executeQuery(
                        "SELECT COUNT(*) FROM sqlite_master WHERE type='index' AND name='idx_kv_entries_expires'")) {
                    Assertions.assertTrue(rs.next());
                    Assertions.assertEquals(1, rs.getInt(1));
                }
            }
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
