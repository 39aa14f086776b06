package io.github.yok.issuesync.db;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.issuesync.config.ConnectionConfig;
import io.github.yok.issuesync.config.PathsConfig;
import io.github.yok.issuesync.store.DoltVersionedStore;
import java.nio.file.Path;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StoreSessionFactoryTest {

    @TempDir
    Path tempDir;

    private ConnectionConfig connectionConfig;
    private PathsConfig pathsConfig;

    @BeforeEach
    void setup() {
        connectionConfig = new ConnectionConfig();
        connectionConfig.setUrl("jdbc:h2:mem:" + UUID.randomUUID().toString().replace("-", ""));
        connectionConfig.setUser("sa");
        connectionConfig.setPassword("");
        pathsConfig = new PathsConfig();
        pathsConfig.setMetadataPath(tempDir.resolve(".issues").toString());
    }

    @Test
    void open_正常ケース_URLが未設定である_空が返ること() throws Exception {
        connectionConfig.setUrl(null);

        Optional<StoreSession> session =
                new StoreSessionFactory(connectionConfig, pathsConfig).open();

        assertFalse(session.isPresent());
    }

    @Test
    void open_正常ケース_接続できる_ロックを保持したセッションが返ること() throws Exception {
        StoreSessionFactory factory = new StoreSessionFactory(connectionConfig, pathsConfig);

        try (StoreSession session = factory.open().orElseThrow()) {
            assertNotNull(session.getConnection());
            assertTrue(session.getStore() instanceof DoltVersionedStore);
            assertNotNull(session.getLock());
            assertThrows(IllegalStateException.class, factory::open);
        }
        // 解放後は再取得できる
        assertDoesNotThrow(() -> AccessLock.acquire(pathsConfig.getLockFile()).close());
    }

    @Test
    void open_正常ケース_メタデータディレクトリが未設定である_ロックなしで開かれること() throws Exception {
        pathsConfig.setMetadataPath(null);

        try (StoreSession session =
                new StoreSessionFactory(connectionConfig, pathsConfig).open().orElseThrow()) {
            assertNull(session.getLock());
        }
    }

    @Test
    void open_異常ケース_ドライバクラスが存在しない_ClassNotFoundExceptionが送出されロックが解放されること() {
        connectionConfig.setDriverClass("com.example.NoSuchDriver");
        StoreSessionFactory factory = new StoreSessionFactory(connectionConfig, pathsConfig);

        assertThrows(ClassNotFoundException.class, factory::open);
        assertDoesNotThrow(() -> AccessLock.acquire(pathsConfig.getLockFile()).close());
    }

    @Test
    void loadDriverIfConfigured_正常ケース_空白を指定する_何もしないこと() {
        assertDoesNotThrow(() -> StoreSessionFactory.loadDriverIfConfigured(" "));
        assertDoesNotThrow(() -> StoreSessionFactory.loadDriverIfConfigured(null));
        assertDoesNotThrow(() -> StoreSessionFactory.loadDriverIfConfigured(" org.h2.Driver "));
    }
}
