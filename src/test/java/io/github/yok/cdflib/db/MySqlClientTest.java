package io.github.yok.cdflib.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.cdflib.config.ConnectionSettings;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MySqlClientTest {

    private JdbcConnector connector;
    private Connection connection;
    private Statement statement;
    private MySqlClient client;

    @BeforeEach
    void setUp() throws Exception {
        connector = mock(JdbcConnector.class);
        connection = mock(Connection.class);
        statement = mock(Statement.class);
        when(connector.connect(any())).thenReturn(connection);
        when(connection.createStatement()).thenReturn(statement);
        client = new MySqlClient(settings(), connector);
    }

    private static ConnectionSettings settings() {
        ConnectionSettings settings = new ConnectionSettings();
        settings.setHostname("localhost");
        settings.setUsername("app");
        settings.setPassword("secret");
        settings.setDatabase("shop");
        return settings;
    }

    private static ResultSet resultSet(String[] labels, Object[]... rows) throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        ResultSetMetaData md = mock(ResultSetMetaData.class);
        when(rs.getMetaData()).thenReturn(md);
        when(md.getColumnCount()).thenReturn(labels.length);
        for (int i = 0; i < labels.length; i++) {
            when(md.getColumnLabel(i + 1)).thenReturn(labels[i]);
        }
        if (rows.length == 0) {
            when(rs.next()).thenReturn(false);
            return rs;
        }
        Boolean[] tail = new Boolean[rows.length];
        for (int r = 0; r < rows.length - 1; r++) {
            tail[r] = true;
        }
        tail[rows.length - 1] = false;
        when(rs.next()).thenReturn(true, tail);
        for (int c = 0; c < labels.length; c++) {
            Object first = rows[0][c];
            Object[] others = new Object[rows.length - 1];
            for (int r = 1; r < rows.length; r++) {
                others[r - 1] = rows[r][c];
            }
            when(rs.getObject(c + 1)).thenReturn(first, others);
        }
        return rs;
    }

    @Test
    void コンストラクタ_異常ケース_認証情報が不足する_IllegalArgumentExceptionが送出されること() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> new MySqlClient(null, connector));
        assertEquals("Missing SQL credentials", ex.getMessage());

        ConnectionSettings noDatabase = settings();
        noDatabase.setDatabase(" ");
        assertThrows(IllegalArgumentException.class, () -> new MySqlClient(noDatabase, connector));
    }

    @Test
    void open_正常ケース_接続する_セッションのタイムゾーンと文字コードが設定されること() throws Exception {
        client.open();
        assertTrue(client.hasConnection());
        verify(statement).execute("SET time_zone = '+00:00'");
        verify(statement).execute("SET NAMES utf8mb4");
    }

    @Test
    void open_異常ケース_接続に失敗する_SqlExecutionExceptionが送出されること() throws Exception {
        when(connector.connect(any())).thenThrow(new SQLException("refused", "08001", 2003));
        SqlExecutionException ex = assertThrows(SqlExecutionException.class, client::open);
        assertEquals(2003, ex.getErrorCode());
        assertEquals("08001", ex.getSQLState());
        assertFalse(client.hasConnection());
    }

    @Test
    void open_異常ケース_セッション設定に失敗する_接続が閉じられること() throws Exception {
        when(statement.execute("SET NAMES utf8mb4")).thenThrow(new SQLException("bad charset"));
        assertThrows(SqlExecutionException.class, client::open);
        verify(connection).close();
        assertFalse(client.hasConnection());
    }

    @Test
    void query_正常ケース_パラメータを指定する_置換済みSQLが実行され行が返ること() throws Exception {
        String expected = "select * from Users where Username='foo' AND Type=12345";
        ResultSet rs = resultSet(new String[] {"Id", "Username"}, new Object[] {1L, "foo"},
                new Object[] {2L, "foo"});
        when(statement.execute(expected)).thenReturn(true);
        when(statement.getResultSet()).thenReturn(rs);

        client.addParameter(SqlDataType.STRING, "<i>foo</i>");
        client.addParameter(SqlDataType.INTEGER, "12345abc");
        List<Map<String, Object>> rows =
                client.query("select * from Users where Username=? AND Type=?");

        assertEquals(2, rows.size());
        assertEquals(Map.of("Id", 1L, "Username", "foo"), rows.get(0));
        assertEquals(2L, rows.get(1).get("Id"));
        assertEquals(2, client.getAffectedRowCount());
        assertTrue(client.getParameters().isEmpty());
        verify(rs).close();
    }

    @Test
    void query_正常ケース_更新文を実行する_空のリストと影響行数が返ること() throws Exception {
        when(statement.execute("update T set A=NULL")).thenReturn(false);
        when(statement.getUpdateCount()).thenReturn(3);

        client.addParameter(SqlDataType.TEXT, null);
        List<Map<String, Object>> rows = client.query("update T set A=?");

        assertTrue(rows.isEmpty());
        assertEquals(3, client.getAffectedRowCount());
    }

    @Test
    void query_正常ケース_置換を省略する_SQLがそのまま実行されること() throws Exception {
        client.addParameter(SqlDataType.INTEGER, 1);
        client.query("select '?'", true);
        verify(statement).execute("select '?'");
    }

    @Test
    void query_異常ケース_パラメータが不足する_実行されずParameterCountExceptionが送出されること() throws Exception {
        client.addParameter(SqlDataType.INTEGER, 1);
        ParameterCountException ex = assertThrows(ParameterCountException.class,
                () -> client.query("select ? , ?"));
        assertEquals(ParameterCountException.Kind.MISSING_PARAMETER, ex.getKind());
        verify(connector, never()).connect(any());
        assertTrue(client.getParameters().isEmpty());
    }

    @Test
    void query_異常ケース_ドライバがエラーを返す_SQLとエラーコード付きで送出されること() throws Exception {
        when(statement.execute("select * from Missing"))
                .thenThrow(new SQLException("Table doesn't exist", "42S02", 1146));
        SqlExecutionException ex = assertThrows(SqlExecutionException.class,
                () -> client.query("select * from Missing"));
        assertEquals("select * from Missing", ex.getSql());
        assertEquals(1146, ex.getErrorCode());
        assertTrue(ex.toString().endsWith("(select * from Missing)"));
        // once after the session setup, once after the failed statement
        verify(statement, times(2)).close();
    }

    @Test
    void query_正常ケース_接続が閉じられている_再接続されること() throws Exception {
        client.query("select 1");
        when(connection.isClosed()).thenReturn(true);
        client.query("select 1");
        verify(connector, times(2)).connect(any());
    }

    @Test
    void addParameter_正常ケース_型ごとに値が変換されること() {
        client.addParameter(SqlDataType.STRING, " <b>x</b> ");
        client.addParameter(SqlDataType.TEXT, "<b>x</b>");
        client.addParameter(SqlDataType.FLOAT, "2.5");
        client.addParameter(SqlDataType.BOOL, "yes");
        client.addParameter(SqlDataType.DATA, "ab");
        client.addParameter(SqlDataType.TIMESTAMP, null);

        List<QueryParameter> params = client.getParameters();
        assertEquals("x", params.get(0).getValue());
        assertEquals("<b>x</b>", params.get(1).getValue());
        assertEquals(2.5, params.get(2).getValue());
        assertEquals(Boolean.TRUE, params.get(3).getValue());
        assertEquals(2, ((byte[]) params.get(4).getValue()).length);
        assertNull(params.get(5).getValue());
    }

    @Test
    void addParameter_異常ケース_型がnull_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class, () -> client.addParameter(null, "x"));
    }

    @Test
    void newQuery_正常ケース_保留中のパラメータがある_クリアされること() {
        client.addParameter(SqlDataType.INTEGER, 1);
        client.newQuery();
        assertTrue(client.getParameters().isEmpty());
        assertEquals(0, client.getAffectedRowCount());
    }

    @Test
    void newQuery_正常ケース_2回続けて呼ぶ_1回呼んだ場合と同じ状態になること() throws Exception {
        ResultSet rs = resultSet(new String[] {"Name"}, new Object[] {"a"});
        when(statement.execute("select Name from T")).thenReturn(true);
        when(statement.getResultSet()).thenReturn(rs);
        client.beginQuery("select Name from T");
        client.addParameter(SqlDataType.INTEGER, 1);

        client.newQuery();
        client.newQuery();

        assertTrue(client.getParameters().isEmpty());
        assertEquals(0, client.getAffectedRowCount());
        assertFalse(client.nextRow().isPresent());
        verify(rs).close();
        // once for the session setup, once for the cursor
        verify(statement, times(2)).close();
    }

    @Test
    void beginQuery_正常ケース_行を順に読む_終端で空が返りカーソルが閉じられること() throws Exception {
        ResultSet rs = resultSet(new String[] {"Name"}, new Object[] {"a"}, new Object[] {"b"});
        when(statement.execute("select Name from T")).thenReturn(true);
        when(statement.getResultSet()).thenReturn(rs);

        client.beginQuery("select Name from T");
        assertEquals("a", client.nextRow().orElseThrow().get("Name"));
        assertEquals("b", client.nextRow().orElseThrow().get("Name"));
        assertEquals(Optional.empty(), client.nextRow());
        assertEquals(Optional.empty(), client.nextRow());
        assertEquals(2, client.getAffectedRowCount());
        verify(rs).close();
    }

    @Test
    void nextRow_正常ケース_カーソルがない_空が返ること() throws Exception {
        assertFalse(client.nextRow().isPresent());
    }

    @Test
    void procedure_正常ケース_パラメータを指定する_CALL文が実行されること() throws Exception {
        client.addParameter(SqlDataType.STRING, "bob");
        client.addParameter(SqlDataType.INTEGER, 7);
        client.procedure("sp_add_user");
        verify(statement).execute("call `sp_add_user`('bob', 7)");
        assertTrue(client.getParameters().isEmpty());
    }

    @Test
    void beginProcedure_正常ケース_結果セットを返す_カーソルで読めること() throws Exception {
        ResultSet rs = resultSet(new String[] {"Total"}, new Object[] {10L});
        when(statement.execute("call `sp_totals`()")).thenReturn(true);
        when(statement.getResultSet()).thenReturn(rs);

        client.beginProcedure("sp_totals");
        assertEquals(10L, client.nextRow().orElseThrow().get("Total"));
        assertFalse(client.nextRow().isPresent());
    }

    @Test
    void lastId_正常ケース_接続済み_最後の自動採番値が返り影響行数が保持されること() throws Exception {
        when(statement.execute("insert into T (A) values (1)")).thenReturn(false);
        when(statement.getUpdateCount()).thenReturn(1);
        ResultSet rs = resultSet(new String[] {"Id"}, new Object[] {42L});
        when(statement.executeQuery("select last_insert_id() as Id")).thenReturn(rs);

        client.query("insert into T (A) values (1)");
        assertEquals(42L, client.lastId());
        assertEquals(1, client.getAffectedRowCount());
        verify(rs).close();
    }

    @Test
    void lastId_正常ケース_カーソルを開いている_カーソルが閉じられず読み続けられること() throws Exception {
        Statement idStatement = mock(Statement.class);
        ResultSet idRs = resultSet(new String[] {"Id"}, new Object[] {7L});
        when(idStatement.executeQuery("select last_insert_id() as Id")).thenReturn(idRs);
        when(connection.createStatement()).thenReturn(statement, statement, idStatement);
        ResultSet rs = resultSet(new String[] {"Name"}, new Object[] {"a"}, new Object[] {"b"});
        when(statement.execute("select Name from T")).thenReturn(true);
        when(statement.getResultSet()).thenReturn(rs);

        client.beginQuery("select Name from T");
        assertEquals("a", client.nextRow().orElseThrow().get("Name"));
        assertEquals(7L, client.lastId());
        assertEquals("b", client.nextRow().orElseThrow().get("Name"));

        verify(idStatement).close();
        assertEquals(2, client.getAffectedRowCount());
    }

    @Test
    void lastId_異常ケース_未接続_IllegalStateExceptionが送出されること() {
        assertThrows(IllegalStateException.class, client::lastId);
    }

    @Test
    void lastId_異常ケース_接続が閉じられている_再接続せずIllegalStateExceptionが送出されること()
            throws Exception {
        client.open();
        when(connection.isClosed()).thenReturn(true);

        assertThrows(IllegalStateException.class, client::lastId);
        verify(connector, times(1)).connect(any());
    }

    @Test
    void escapeVariable_正常ケース_接続済み_エスケープ済み文字列が返ること() throws Exception {
        assertThrows(IllegalStateException.class, () -> client.escapeVariable("x"));
        client.open();
        assertEquals("O\\'Brien", client.escapeVariable("O'Brien"));
    }

    @Test
    void close_正常ケース_接続済み_接続が解放されること() throws Exception {
        client.open();
        client.close();
        assertFalse(client.hasConnection());
        verify(connection).close();
        client.close();
        verify(connection, times(1)).close();
    }

    @Test
    void close_正常ケース_解放に失敗する_例外が送出されないこと() throws Exception {
        doThrow(new SQLException("gone")).when(connection).close();
        client.open();
        client.close();
        assertFalse(client.hasConnection());
    }
}
