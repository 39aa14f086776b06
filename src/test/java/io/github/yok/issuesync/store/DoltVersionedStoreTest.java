package io.github.yok.issuesync.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DoltVersionedStoreTest {

    private Connection conn;
    private DoltVersionedStore store;

    @BeforeEach
    void setup() {
        conn = mock(Connection.class);
        store = new DoltVersionedStore(conn);
    }

    @Test
    void commit_正常ケース_メッセージを指定する_DOLT_COMMITが実行されること() throws Exception {
        PreparedStatement ps = mock(PreparedStatement.class);
        when(conn.prepareStatement(DoltVersionedStore.COMMIT_SQL)).thenReturn(ps);

        store.commit("msg");

        verify(ps).setString(1, "msg");
        verify(ps).execute();
        verify(ps).close();
    }

    @Test
    void commit_異常ケース_変更がない_SQLExceptionがそのまま送出されること() throws Exception {
        PreparedStatement ps = mock(PreparedStatement.class);
        SQLException nothing = new SQLException("nothing to commit");
        when(conn.prepareStatement(DoltVersionedStore.COMMIT_SQL)).thenReturn(ps);
        when(ps.execute()).thenThrow(nothing);

        assertSame(nothing, assertThrows(SQLException.class, () -> store.commit("msg")));
        verify(ps).close();
    }

    @Test
    void hasRemote_正常ケース_リモートが存在する_trueが返ること() throws Exception {
        PreparedStatement ps = mock(PreparedStatement.class);
        ResultSet rs = mock(ResultSet.class);
        when(conn.prepareStatement(DoltVersionedStore.REMOTE_SQL)).thenReturn(ps);
        when(ps.executeQuery()).thenReturn(rs);
        when(rs.next()).thenReturn(true);

        assertTrue(store.hasRemote("origin"));
        verify(ps).setString(1, "origin");
    }

    @Test
    void hasRemote_正常ケース_リモートが存在しない_falseが返ること() throws Exception {
        PreparedStatement ps = mock(PreparedStatement.class);
        ResultSet rs = mock(ResultSet.class);
        when(conn.prepareStatement(DoltVersionedStore.REMOTE_SQL)).thenReturn(ps);
        when(ps.executeQuery()).thenReturn(rs);
        when(rs.next()).thenReturn(false);

        assertFalse(store.hasRemote("origin"));
    }

    @Test
    void push_正常ケース_アクティブブランチがある_リモートとブランチを指定してDOLT_PUSHが実行されること()
            throws Exception {
        Statement stmt = mock(Statement.class);
        ResultSet rs = mock(ResultSet.class);
        PreparedStatement ps = mock(PreparedStatement.class);
        when(conn.createStatement()).thenReturn(stmt);
        when(stmt.executeQuery(DoltVersionedStore.ACTIVE_BRANCH_SQL)).thenReturn(rs);
        when(rs.next()).thenReturn(true);
        when(rs.getString(1)).thenReturn("main");
        when(conn.prepareStatement(DoltVersionedStore.PUSH_SQL)).thenReturn(ps);

        store.push("origin");

        verify(ps).setString(1, "origin");
        verify(ps).setString(2, "main");
        verify(ps).execute();
    }

    @Test
    void push_異常ケース_アクティブブランチがない_SQLExceptionが送出されpushされないこと() throws Exception {
        Statement stmt = mock(Statement.class);
        ResultSet rs = mock(ResultSet.class);
        when(conn.createStatement()).thenReturn(stmt);
        when(stmt.executeQuery(DoltVersionedStore.ACTIVE_BRANCH_SQL)).thenReturn(rs);
        when(rs.next()).thenReturn(false);

        SQLException ex = assertThrows(SQLException.class, () -> store.push("origin"));
        assertEquals("No active branch in the current session", ex.getMessage());
        verify(conn, never()).prepareStatement(DoltVersionedStore.PUSH_SQL);
    }

    @Test
    void constructor_異常ケース_nullを指定する_NullPointerExceptionが送出されること() {
        assertThrows(NullPointerException.class, () -> new DoltVersionedStore(null));
    }
}
