package io.github.yok.chunkload.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;

class PathsConfigTest {

    @Test
    void getSourceDir_正常ケース_dataPathを設定する_同じパスが返ること() {
        PathsConfig config = new PathsConfig();
        config.setDataPath("/var/data");
        assertEquals(Paths.get("/var/data"), config.getSourceDir());
    }

    @Test
    void getChunkDir_正常ケース_dataPath配下のchunksが返ること() {
        PathsConfig config = new PathsConfig();
        config.setDataPath("/var/data");
        assertEquals(Paths.get("/var/data", "chunks"), config.getChunkDir());
    }

    @Test
    void resolveSourceFile_正常ケース_テーブルと日付からファイル名が組み立てられること() {
        PathsConfig config = new PathsConfig();
        config.setDataPath("/var/data");
        assertEquals(Paths.get("/var/data", "orders-20240501.csv"),
                config.resolveSourceFile("orders", "20240501"));
    }

    @Test
    void getSourceDir_異常ケース_dataPathが未設定_IllegalStateExceptionが送出されること() {
        PathsConfig config = new PathsConfig();
        assertThrows(IllegalStateException.class, config::getSourceDir);
        config.setDataPath("  ");
        assertThrows(IllegalStateException.class, config::getChunkDir);
    }
}
