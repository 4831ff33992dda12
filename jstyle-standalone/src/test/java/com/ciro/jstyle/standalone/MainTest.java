package com.ciro.jstyle.standalone;

import com.ciro.jstyle.LockedStyleSheet;
import com.ciro.jstyle.StyleSheetFactory;
import com.ciro.jstyle.tree.StyleTreeReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class MainTest {

    @Test
    void preloadRegistersValidFilesAndSkipsBrokenOnes(@TempDir Path dir) throws Exception {
        Path button = Files.writeString(dir.resolve("button.json"), "{\"color\":\"red\"}");
        Path broken = Files.writeString(dir.resolve("broken.json"), "{color");
        Path missing = dir.resolve("missing.json");

        LockedStyleSheet sheet = new LockedStyleSheet(new StyleSheetFactory().create());
        int loaded = Main.preload(sheet, new StyleTreeReader(ObjectMapperFactory.create()),
                new String[]{button.toString(), broken.toString(), missing.toString()});

        assertThat(loaded).isEqualTo(1);
        assertThat(sheet.render(false)).isEqualTo(".1rscope{color:red;}");
    }
}
