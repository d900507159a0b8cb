package org.scanroi.scan;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScanTest {

    private static Scan scanWithL(double... ls) {
        List<MetadataRow> rows = new ArrayList<>();
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < ls.length; i++) {
            rows.add(ScanFixtures.row72(ls[i], 1, 0));
            ids.add("f" + i);
        }
        return ScanAssembler.assemble(rows, ids, id -> Frame.filled(2, 2, 1.0), FoilAttenuation.of(0, 0, 0, 0), ScanLayout.BL72);
    }

    @Test
    void nearestIndex_returnsClosestValue() {
        Scan scan = scanWithL(1.0, 2.5, 4.0);

        assertThat(scan.nearestIndex("l", 2.6)).isEqualTo(1);
        assertThat(scan.nearestIndex("L", 100)).isEqualTo(2);
        assertThat(scan.nearestIndex("l", -5)).isEqualTo(0);
    }

    @Test
    void nearestIndex_breaksTiesByLowestIndex() {
        Scan scan = scanWithL(1.0, 2.5, 1.0);

        assertThat(scan.nearestIndex("l", 1.75)).isEqualTo(0);
        assertThat(scan.nearestIndex("l", 1.0)).isEqualTo(0);
    }

    @Test
    void nearestIndex_skipsNaN() {
        Scan scan = scanWithL(Double.NaN, 3.0);

        assertThat(scan.nearestIndex("l", 0)).isEqualTo(1);
    }

    @Test
    void nearestIndex_rejectsUnknownColumn() {
        Scan scan = scanWithL(1.0);

        assertThatThrownBy(() -> scan.nearestIndex("twotheta", 1))
                .isInstanceOfSatisfying(ScanException.class, e -> assertThat(e.kind()).isEqualTo(ScanException.Kind.UNKNOWN_COLUMN));
        assertThatThrownBy(() -> scan.nearestIndex(Scan.PEAK_X, 1))
                .isInstanceOfSatisfying(ScanException.class, e -> assertThat(e.kind()).isEqualTo(ScanException.Kind.UNKNOWN_COLUMN));
    }

    @Test
    void nearestIndex_rejectsEmptyScan() {
        assertThatThrownBy(() -> scanWithL().nearestIndex("l", 1))
                .isInstanceOfSatisfying(ScanException.class, e -> assertThat(e.kind()).isEqualTo(ScanException.Kind.EMPTY_SCAN));
    }

    @Test
    void columns_includePeakColumnsOnlyAfterCrop() {
        Scan scan = ScanFixtures.unitScan(
                ScanFixtures.hotPixel(3, 4, 0, 1, 2, 5),
                ScanFixtures.hotPixel(3, 4, 0, 2, 3, 5));
        assertThat(scan.columns()).doesNotContain(Scan.PEAK_X, Scan.PEAK_Y);

        Cropper.crop(scan, 1, 4);

        assertThat(scan.columns()).contains(Scan.PEAK_X, Scan.PEAK_Y, Scan.ATTENUATION);
        assertThat(scan.columnValues(Scan.PEAK_X)).containsExactly(1.0, 2.0);
        assertThat(scan.columnValues(Scan.PEAK_Y)).containsExactly(1.0, 2.0);
        assertThat(scan.nearestIndex(Scan.PEAK_X, 2)).isEqualTo(1);
        assertThat(scan.columnValues(Scan.ATTENUATION)).containsExactly(1.0, 1.0);
    }
}
