package io.github.yok.cdflib.integration;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.cdflib.config.ConnectionSettings;
import io.github.yok.cdflib.core.DataHelper;
import io.github.yok.cdflib.data.BinaryColumn;
import io.github.yok.cdflib.data.BoolColumn;
import io.github.yok.cdflib.data.DataRowMapper;
import io.github.yok.cdflib.data.FloatColumn;
import io.github.yok.cdflib.data.IntegerColumn;
import io.github.yok.cdflib.data.OrderBy;
import io.github.yok.cdflib.data.StringColumn;
import io.github.yok.cdflib.data.TimestampColumn;
import io.github.yok.cdflib.data.WhereClause;
import io.github.yok.cdflib.db.MySqlClient;
import io.github.yok.cdflib.db.SqlDataType;
import io.github.yok.cdflib.db.SqlExecutionException;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Integration tests for the MySQL client and row mapper against a MySQL container.
 *
 * <p>
 * Skipped when no Docker environment is available.
 * </p>
 */
@Testcontainers(disabledWithoutDocker = true)
public class MySqlClientIntegrationTest {

    @Container
    private static final MySQLContainer<?> mysql = createMysql();

    private static MySQLContainer<?> createMysql() {
        MySQLContainer<?> container = new MySQLContainer<>("mysql:8.0");
        container.withDatabaseName("testdb").withUsername("test").withPassword("test");
        return container;
    }

    private MySqlClient client;

    @BeforeEach
    public void setup() throws Exception {
        ConnectionSettings settings = new ConnectionSettings();
        settings.setHostname(mysql.getHost());
        settings.setPort(mysql.getMappedPort(MySQLContainer.MYSQL_PORT));
        settings.setUsername(mysql.getUsername());
        settings.setPassword(mysql.getPassword());
        settings.setDatabase(mysql.getDatabaseName());
        client = new MySqlClient(settings);

        client.query("drop table if exists widgets", true);
        client.query("create table widgets (Id int auto_increment primary key,"
                + " Name varchar(50) not null, Price double, Active tinyint(1),"
                + " Created datetime null, Payload blob)", true);
    }

    @AfterEach
    public void tearDown() {
        client.close();
    }

    private static DataRowMapper widgetRow() {
        DataRowMapper row = new DataRowMapper("widgets");
        row.addColumns(new IntegerColumn("Id"), new StringColumn("Name"),
                new FloatColumn("Price"), new BoolColumn("Active"),
                new TimestampColumn("Created"), new BinaryColumn("Payload"));
        return row;
    }

    @Test
    public void queryInsertInto_正常ケース_行を登録して読み戻す_全列の値が一致すること() throws Exception {
        ZonedDateTime created = ZonedDateTime.of(2024, 3, 15, 10, 20, 30, 0, DataHelper.GMT);
        DataRowMapper row = widgetRow();
        row.setColumnString("Name", "Sprocket's ?");
        row.setColumnFloat("Price", 9.75);
        row.setColumnBoolean("Active", true);
        row.setColumnDateTime("Created", created);
        row.setColumnData("Payload", new byte[] {0x00, 0x27, (byte) 0xFF});

        assertEquals(1, row.queryInsertInto(client));
        long id = client.lastId();
        assertTrue(id > 0);

        List<Map<String, Object>> rows =
                widgetRow().querySelect(client, WhereClause.ofPairs("Id", id));
        assertEquals(1, rows.size());

        DataRowMapper loaded = widgetRow();
        assertTrue(loaded.loadColumnValues(rows.get(0)));
        assertEquals(id, loaded.getColumnInteger("Id"));
        assertEquals("Sprocket's ?", loaded.getColumnString("Name"));
        assertEquals(9.75, loaded.getColumnFloat("Price"));
        assertTrue(loaded.getColumnBoolean("Active"));
        assertEquals(created, loaded.getColumnDateTime("Created"));
        assertArrayEquals(new byte[] {0x00, 0x27, (byte) 0xFF}, loaded.getColumnData("Payload"));
    }

    @Test
    public void querySelect_正常ケース_複数値と並び順を指定する_該当行が順に返ること() throws Exception {
        for (String name : new String[] {"b", "a", "c"}) {
            DataRowMapper row = widgetRow();
            row.setColumnString("Name", name);
            row.queryInsertInto(client);
        }

        List<Map<String, Object>> rows = widgetRow().querySelect(client, null, null,
                WhereClause.of(Map.of("Name", List.of("a", "b"))), List.of(OrderBy.desc("Name")));

        assertEquals(2, rows.size());
        assertEquals("b", rows.get(0).get("Name"));
        assertEquals("a", rows.get(1).get("Name"));
    }

    @Test
    public void queryUpdate_正常ケース_Idを条件に更新する_1行が更新されNULLが保存されること() throws Exception {
        DataRowMapper row = widgetRow();
        row.setColumnString("Name", "old");
        row.queryInsertInto(client);
        long id = client.lastId();
        row.setColumnInteger("Id", id);

        row.setColumnString("Name", "new");
        assertEquals(1, row.queryUpdate(client, "Id"));

        client.newQuery();
        client.addParameter(SqlDataType.INTEGER, id);
        List<Map<String, Object>> rows =
                client.query("select Name, Created from widgets where Id=?");
        assertEquals("new", rows.get(0).get("Name"));
        assertNull(rows.get(0).get("Created"));
    }

    @Test
    public void queryDelete_正常ケース_条件を指定する_該当行のみ削除されること() throws Exception {
        for (String name : new String[] {"keep", "drop"}) {
            DataRowMapper row = widgetRow();
            row.setColumnString("Name", name);
            row.queryInsertInto(client);
        }

        assertEquals(1, widgetRow().queryDelete(client, WhereClause.ofPairs("Name", "drop")));
        assertEquals(1, client.query("select * from widgets").size());
    }

    @Test
    public void beginQuery_正常ケース_カーソルで読む_全行を順に取得できること() throws Exception {
        for (int i = 0; i < 3; i++) {
            DataRowMapper row = widgetRow();
            row.setColumnString("Name", "w" + i);
            row.queryInsertInto(client);
        }

        client.newQuery();
        client.beginQuery("select Name from widgets order by Id");
        int count = 0;
        Optional<Map<String, Object>> next;
        while ((next = client.nextRow()).isPresent()) {
            assertEquals("w" + count, next.get().get("Name"));
            count++;
        }
        assertEquals(3, count);
        assertFalse(client.nextRow().isPresent());
    }

    @Test
    public void query_異常ケース_存在しないテーブル_SQLとエラーコード付きで送出されること() {
        SqlExecutionException ex = assertThrows(SqlExecutionException.class,
                () -> client.query("select * from missing_table"));
        assertEquals("select * from missing_table", ex.getSql());
        assertEquals(1146, ex.getErrorCode());
    }
}
