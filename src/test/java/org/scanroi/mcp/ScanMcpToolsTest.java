package org.scanroi.mcp;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.scanroi.filesystem.FrameFixtures;
import org.scanroi.filesystem.ScanServerProperties;
import org.scanroi.filesystem.ScanSessionStore;
import org.scanroi.filesystem.SecurePathResolver;
import org.scanroi.filesystem.dto.CropResult;
import org.scanroi.filesystem.dto.CropWindowResult;
import org.scanroi.filesystem.dto.FrameListResult;
import org.scanroi.filesystem.dto.NearestIndexResult;
import org.scanroi.filesystem.dto.PointViewResult;
import org.scanroi.filesystem.dto.RoiSignalResult;
import org.scanroi.filesystem.dto.ScanAssembleResult;
import org.scanroi.filesystem.dto.SidecarReadResult;
import org.scanroi.scan.ScanException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ScanMcpToolsTest {

    private static final List<Double> FOILS = List.of(0.0, 0.0, 0.1, 0.2);

    @TempDir
    Path root;

    private ScanMcpTools tools;
    private ScanSessionStore sessions;

    @BeforeEach
    void setUp() throws Exception {
        ScanServerProperties properties = new ScanServerProperties();
        properties.setRoots(List.of(root.toString()));
        properties.setDetectorRows(5);
        properties.setDetectorColumns(12);
        sessions = new ScanSessionStore(Duration.ofMinutes(5), 4);
        tools = new ScanMcpTools(properties, new SecurePathResolver(properties), sessions);

        Path frames = Files.createDirectories(root.resolve("run1/frames"));
        // 热点在第 2 行，列 4、6、8 逐帧漂移；故意打乱写入顺序
        FrameFixtures.writeRaw(frames.resolve("run1_0003.raw"), 5, 12, 1, 2, 8, 1000);
        FrameFixtures.writeRaw(frames.resolve("run1_0001.raw"), 5, 12, 1, 2, 4, 1000);
        FrameFixtures.writeRaw(frames.resolve("run1_0002.raw"), 5, 12, 1, 2, 6, 1000);
        Files.writeString(frames.resolve("run1_0001.raw.pdi"), FrameFixtures.sidecarText(12.0, 24.0));
        Files.writeString(root.resolve("run1/scan.csv"), """
                h, k, l, Monitor, Foils
                0,0,1.0,10,0
                0,0,1.01,10,0
                0,0,1.02,10,11
                """);
    }

    private ScanAssembleResult assemble() {
        return tools.assemble(null, "run1/scan.csv", "run1/frames", FOILS, "72");
    }

    @Test
    void listFrames_ordersBySequence() {
        FrameListResult result = tools.listFrames(null, "run1/frames");

        assertThat(result.rootId()).isEqualTo("root0");
        assertThat(result.folder()).isEqualTo("run1/frames");
        assertThat(result.frameIds()).containsExactly("run1_0001.raw", "run1_0002.raw", "run1_0003.raw");
        assertThat(result.sidecarIds()).containsExactly("run1_0001.raw.pdi");
    }

    @Test
    void readSidecar_returnsMotors() {
        SidecarReadResult result = tools.readSidecar(null, "run1/frames/run1_0001.raw.pdi");

        assertThat(result.motors().th()).isEqualTo(12.0);
        assertThat(result.motors().tth()).isEqualTo(24.0);
        assertThat(result.motors().lambda()).isEqualTo(1.0332);
    }

    @Test
    void assemble_joinsRowsAndFramesByPosition() {
        ScanAssembleResult result = assemble();

        assertThat(result.scanId()).isNotBlank();
        assertThat(result.layout()).isEqualTo("BL72");
        assertThat(result.size()).isEqualTo(3);
        assertThat(result.frameRows()).isEqualTo(5);
        assertThat(result.frameColumns()).isEqualTo(12);
        assertThat(result.columns()).contains("l", "attenuation");
        assertThat(result.points()).extracting(p -> p.frameId())
                .containsExactly("run1_0001.raw", "run1_0002.raw", "run1_0003.raw");
        assertThat(result.points().get(0).rawSum()).isEqualTo(1059.0);
        assertThat(result.points().get(2).foilCode()).isEqualTo(11L);
        assertThat(result.points().get(2).attenuation()).isCloseTo(Math.exp(0.3), within(1e-12));
        assertThat(sessions.size()).isEqualTo(1);
    }

    @Test
    void assemble_rejectsUnsupportedBeamlineBeforeReading() {
        assertThatThrownBy(() -> tools.assemble(null, "run1/scan.csv", "run1/frames", FOILS, "11"))
                .isInstanceOfSatisfying(ScanException.class, e -> assertThat(e.kind()).isEqualTo(ScanException.Kind.UNSUPPORTED_LAYOUT));
        assertThat(sessions.size()).isZero();
    }

    @Test
    void assemble_rejectsRowFrameCountMismatch() throws Exception {
        FrameFixtures.writeRaw(root.resolve("run1/frames/run1_0004.raw"), 5, 12, 1, 0, 0, 1);

        assertThatThrownBy(this::assemble)
                .isInstanceOfSatisfying(ScanException.class, e -> assertThat(e.kind()).isEqualTo(ScanException.Kind.LENGTH_MISMATCH));
        assertThat(sessions.size()).isZero();
    }

    @Test
    void assemble_rejectsBlankMonitorCell() throws Exception {
        Files.writeString(root.resolve("run1/scan.csv"), """
                h,k,l,monitor,foils
                0,0,1.0,10,0
                0,0,1.01,,0
                0,0,1.02,10,11
                """);

        assertThatThrownBy(this::assemble)
                .isInstanceOfSatisfying(ScanException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ScanException.Kind.DIVIDE_BY_ZERO_MONITOR);
                    assertThat(e.pointIndex()).isEqualTo(1);
                });
        assertThat(sessions.size()).isZero();
    }

    @Test
    void assemble_refusesPathsOutsideRoots() {
        assertThatThrownBy(() -> tools.assemble(null, "../scan.csv", "run1/frames", FOILS, "72"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cropAndIntegrate_endToEnd() {
        String scanId = assemble().scanId();

        CropWindowResult window = tools.suggestCropWindow(scanId, 6, null);
        assertThat(window.center()).isEqualTo(8);
        assertThat(window.lim1()).isEqualTo(5);
        assertThat(window.lim2()).isEqualTo(11);
        assertThat(window.profile()).hasSize(12);
        assertThat(window.warnings()).isNull();

        CropResult crop = tools.crop(scanId, 2, 11);
        assertThat(crop.cropColumns()).isEqualTo(9);
        assertThat(crop.peakX()).containsExactly(2, 4, 6);
        assertThat(crop.peakY()).containsExactly(2, 2, 2);

        RoiSignalResult fixed = tools.extractRoi(scanId, 4, 2, 3, 3);
        assertThat(fixed.mode()).isEqualTo("fixed");
        assertThat(fixed.centerX()).containsExactly(4, 4, 4);
        assertThat(fixed.signal().get(0)).isCloseTo(0.9, within(1e-9));
        assertThat(fixed.signal().get(1)).isCloseTo(100.8, within(1e-9));
        assertThat(fixed.signal().get(2)).isCloseTo(9 * Math.exp(0.3) / 10, within(1e-9));

        RoiSignalResult tracked = tools.trackRoi(scanId, 2, 3, 3);
        assertThat(tracked.mode()).isEqualTo("tracked");
        assertThat(tracked.centerX()).containsExactly(2, 4, 6);
        assertThat(tracked.signal().get(0)).isCloseTo(100.8, within(1e-9));
        assertThat(tracked.signal().get(1)).isCloseTo(100.8, within(1e-9));
        assertThat(tracked.signal().get(2)).isCloseTo(1008 * Math.exp(0.3) / 10, within(1e-9));
    }

    @Test
    void suggestCropWindow_warnsWhenWindowLeavesFrame() {
        String scanId = assemble().scanId();

        CropWindowResult window = tools.suggestCropWindow(scanId, 10, null);

        assertThat(window.lim2()).isEqualTo(13);
        assertThat(window.warnings()).hasSize(1);
    }

    @Test
    void extractRoi_requiresCrop() {
        String scanId = assemble().scanId();

        assertThatThrownBy(() -> tools.extractRoi(scanId, 4, 2, 3, 3))
                .isInstanceOfSatisfying(ScanException.class, e -> assertThat(e.kind()).isEqualTo(ScanException.Kind.SCAN_NOT_CROPPED));
    }

    @Test
    void trackRoi_reportsOffendingPoint() {
        String scanId = assemble().scanId();
        tools.crop(scanId, 4, 11);

        assertThatThrownBy(() -> tools.trackRoi(scanId, 2, 3, 3))
                .isInstanceOfSatisfying(ScanException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ScanException.Kind.ROI_OUT_OF_BOUNDS);
                    assertThat(e.pointIndex()).isEqualTo(0);
                });
    }

    @Test
    void nearestIndexAndView() {
        String scanId = assemble().scanId();
        tools.crop(scanId, 2, 11);

        NearestIndexResult nearest = tools.nearestIndex(scanId, "L", 1.012);
        assertThat(nearest.index()).isEqualTo(1);
        assertThat(nearest.value()).isEqualTo(1.01);

        PointViewResult view = tools.viewPoint(scanId, nearest.index(), null);
        assertThat(view.title()).isEqualTo("L = 1.01");
        assertThat(view.peakX()).isEqualTo(4);
        assertThat(view.peakY()).isEqualTo(2);
        assertThat(view.peakValue()).isEqualTo(100.0);
        assertThat(view.yMedian()).isEqualTo(2.0);
        assertThat(view.yBottom()).isEqualTo(-38.0);
        assertThat(view.yTop()).isEqualTo(42.0);

        assertThatThrownBy(() -> tools.viewPoint(scanId, 3, null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void release_dropsSession() {
        String scanId = assemble().scanId();

        assertThat(tools.release(scanId).released()).isTrue();
        assertThatThrownBy(() -> tools.crop(scanId, 0, 5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void median_averagesMiddlePairForEvenCount() {
        assertThat(ScanMcpTools.median(new double[]{4, 1, 3, 2})).isEqualTo(2.5);
        assertThat(ScanMcpTools.median(new double[]{5, 1, 3})).isEqualTo(3.0);
    }
}
