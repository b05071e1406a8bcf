package io.github.yok.cdflib.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationSettingsTest {

    @TempDir
    Path tempDir;

    private Path writeIni(String content) throws Exception {
        Path file = tempDir.resolve("settings.ini");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void getSection_正常ケース_iniファイルを指定する_セクションの全キーが返ること() throws Exception {
        ConfigurationSettings config = new ConfigurationSettings();
        config.setConfigFile(writeIni("; application settings\n" + "[database]\n"
                + "hostname = localhost\n" + "password = \"p=ss\"\n" + "# comment\n" + "\n"
                + "[site]\n" + "name=Shop\n"));

        Map<String, String> database = config.getSection("database");
        assertEquals(Map.of("hostname", "localhost", "password", "p=ss"), database);
        assertEquals("Shop", config.getValue("site", "name"));
    }

    @Test
    void getSection_正常ケース_存在しないセクションを指定する_nullが返ること() throws Exception {
        ConfigurationSettings config = new ConfigurationSettings();
        config.setConfigFile(writeIni("[a]\nk=v\n"));
        assertNull(config.getSection("b"));
        assertNull(config.getValue("b", "k"));
        assertNull(config.getValue("a", "missing"));
    }

    @Test
    void getValue_正常ケース_セクション前のキーと等号なし行_無視されること() throws Exception {
        ConfigurationSettings config = new ConfigurationSettings();
        config.setConfigFile(writeIni("orphan=1\n[a]\nnot a pair\nk =\n"));
        assertEquals(Map.of("k", ""), config.getSection("a"));
    }

    @Test
    void setConfigFile_異常ケース_存在しないファイルを指定する_IllegalArgumentExceptionが送出されること() {
        ConfigurationSettings config = new ConfigurationSettings();
        assertThrows(IllegalArgumentException.class,
                () -> config.setConfigFile(tempDir.resolve("missing.ini")));
        assertThrows(IllegalArgumentException.class, () -> config.setConfigFile(tempDir));
    }

    @Test
    void getSection_異常ケース_ファイル未設定_IllegalStateExceptionが送出されること() {
        ConfigurationSettings config = new ConfigurationSettings();
        assertThrows(IllegalStateException.class, () -> config.getSection("a"));
    }

    @Test
    void setConfigFile_正常ケース_別のファイルに切り替える_新しい内容が読まれること() throws Exception {
        ConfigurationSettings config = new ConfigurationSettings();
        config.setConfigFile(writeIni("[a]\nk=1\n"));
        assertEquals("1", config.getValue("a", "k"));

        Path other = tempDir.resolve("other.ini");
        Files.writeString(other, "[a]\nk=2\n", StandardCharsets.UTF_8);
        config.setConfigFile(other);
        assertEquals("2", config.getValue("a", "k"));
    }

    @Test
    void fromSection_正常ケース_iniのセクションから接続設定を作る_検証を通ること() throws Exception {
        ConfigurationSettings config = new ConfigurationSettings();
        config.setConfigFile(writeIni(
                "[mysql]\nhostname=localhost\nusername=app\npassword=\ndatabase=shop\nport=3307\n"));
        ConnectionSettings settings = ConnectionSettings.fromSection(config.getSection("mysql"));
        settings.validate();
        assertEquals("jdbc:mysql://localhost:3307/shop", settings.toJdbcUrl());
    }
}
