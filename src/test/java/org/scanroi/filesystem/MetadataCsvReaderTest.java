package org.scanroi.filesystem;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetadataCsvReaderTest {

    @Test
    void read_normalizesHeadersAndParsesNumbers() {
        String csv = """
                 H, K ,L,Monitor, Foils
                0,0,1.0,1000,11
                0,0,1.005,998.5,0
                """;

        MetadataCsvReader.MetadataTable table = MetadataCsvReader.read(csv);

        assertThat(table.columns()).containsExactly("h", "k", "l", "monitor", "foils");
        assertThat(table.rows()).hasSize(2);
        assertThat(table.rows().get(0).value("foils")).isEqualTo(11.0);
        assertThat(table.rows().get(1).value("L")).isEqualTo(1.005);
        assertThat(table.rows().get(1).value("monitor")).isEqualTo(998.5);
    }

    @Test
    void read_blankCellIsNaN() {
        MetadataCsvReader.MetadataTable table = MetadataCsvReader.read("h,k\n1,\n");

        assertThat(table.rows().get(0).value("k")).isNaN();
    }

    @Test
    void read_rejectsNonNumericCell() {
        assertThatThrownBy(() -> MetadataCsvReader.read("h,k\n1,abc\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("k");
    }

    @Test
    void read_headerOnlyGivesEmptyTable(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("scan.csv"), "h,k,l,monitor,foils\n");

        MetadataCsvReader.MetadataTable table = MetadataCsvReader.read(file);

        assertThat(table.rows()).isEmpty();
        assertThat(table.columns()).containsExactly("h", "k", "l", "monitor", "foils");
    }
}
