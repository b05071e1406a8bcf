package io.github.yok.cdflib.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class ConnectionSettingsTest {

    @Test
    void getter_正常ケース_デフォルト値を取得する_既定のポートと文字コードが返ること() {
        ConnectionSettings settings = new ConnectionSettings();
        assertEquals(3306, settings.getPort());
        assertEquals("utf8mb4", settings.getCharset());
        assertEquals(0, settings.getConnectTimeoutMillis());
        assertNull(settings.getHostname());
    }

    @Test
    void bind_正常ケース_プロパティを指定する_cdfmysql配下が束縛されること() {
        MapConfigurationPropertySource source = new MapConfigurationPropertySource(
                Map.of("cdf.mysql.hostname", "db.example.com", "cdf.mysql.port", "3307",
                        "cdf.mysql.username", "app", "cdf.mysql.password", "secret",
                        "cdf.mysql.database", "shop", "cdf.mysql.connect-timeout-millis", "5000"));

        ConnectionSettings settings = new Binder(source)
                .bind("cdf.mysql", ConnectionSettings.class).get();

        assertEquals("db.example.com", settings.getHostname());
        assertEquals(3307, settings.getPort());
        assertEquals("shop", settings.getDatabase());
        assertEquals("utf8mb4", settings.getCharset());
        assertEquals("jdbc:mysql://db.example.com:3307/shop?connectTimeout=5000",
                settings.toJdbcUrl());
    }

    @Test
    void fromSection_正常ケース_iniセクションを指定する_設定が生成されること() {
        ConnectionSettings settings = ConnectionSettings.fromSection(Map.of("hostname", "localhost",
                "username", "app", "password", "pw", "database", "shop", "port", " 3310 ",
                "charset", "latin1"));
        assertEquals("localhost", settings.getHostname());
        assertEquals(3310, settings.getPort());
        assertEquals("latin1", settings.getCharset());
        assertEquals("jdbc:mysql://localhost:3310/shop", settings.toJdbcUrl());
    }

    @Test
    void fromSection_正常ケース_nullを指定する_空の設定が返ること() {
        ConnectionSettings settings = ConnectionSettings.fromSection(null);
        assertNull(settings.getHostname());
        assertEquals(3306, settings.getPort());
    }

    @Test
    void validate_異常ケース_必須項目が欠けている_IllegalArgumentExceptionが送出されること() {
        ConnectionSettings settings =
                ConnectionSettings.fromSection(Map.of("hostname", "localhost", "username", "app"));
        IllegalArgumentException ex =
                assertThrows(IllegalArgumentException.class, settings::validate);
        assertEquals("Missing SQL credentials", ex.getMessage());
    }

    @Test
    void validate_異常ケース_ポートが範囲外_IllegalArgumentExceptionが送出されること() {
        ConnectionSettings settings = ConnectionSettings.fromSection(
                Map.of("hostname", "localhost", "username", "app", "database", "shop"));
        settings.setPort(70000);
        assertThrows(IllegalArgumentException.class, settings::validate);
    }

    @Test
    void toString_正常ケース_パスワードを設定する_パスワードが出力されないこと() {
        ConnectionSettings settings = ConnectionSettings.fromSection(Map.of("hostname", "h",
                "username", "u", "password", "topsecret", "database", "d"));
        assertEquals("ConnectionSettings(u@h:3306/d)", settings.toString());
        assertFalse(settings.toString().contains("topsecret"));
    }
}
