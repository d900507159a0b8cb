package org.scanroi.mcp;

import org.scanroi.filesystem.MetadataCsvReader;
import org.scanroi.filesystem.RawFrameStore;
import org.scanroi.filesystem.ScanServerProperties;
import org.scanroi.filesystem.ScanSessionStore;
import org.scanroi.filesystem.SecurePathResolver;
import org.scanroi.filesystem.SidecarMetadataParser;
import org.scanroi.filesystem.dto.CropResult;
import org.scanroi.filesystem.dto.CropWindowResult;
import org.scanroi.filesystem.dto.DataRootsResult;
import org.scanroi.filesystem.dto.FrameListResult;
import org.scanroi.filesystem.dto.NearestIndexResult;
import org.scanroi.filesystem.dto.PointViewResult;
import org.scanroi.filesystem.dto.ReleaseResult;
import org.scanroi.filesystem.dto.RoiSignalResult;
import org.scanroi.filesystem.dto.ScanAssembleResult;
import org.scanroi.filesystem.dto.ScanPointSummary;
import org.scanroi.filesystem.dto.SidecarReadResult;
import org.scanroi.scan.CropColumns;
import org.scanroi.scan.CropWindow;
import org.scanroi.scan.Cropper;
import org.scanroi.scan.CroppedPoint;
import org.scanroi.scan.FoilAttenuation;
import org.scanroi.scan.RoiEngine;
import org.scanroi.scan.RoiMask;
import org.scanroi.scan.RoiSelection;
import org.scanroi.scan.Scan;
import org.scanroi.scan.ScanAssembler;
import org.scanroi.scan.ScanLayout;
import org.scanroi.scan.ScanPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 扫描归约 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>列出数据根目录（{@code scan_list_roots}）与帧目录内容（{@code scan_list_frames}）。</li>
 *   <li>读取帧侧车文件里的电机位置/标定参数（{@code scan_read_sidecar}）。</li>
 *   <li>组装扫描（{@code scan_assemble}）：扫描表 + 原始帧 -> 衰减修正 + monitor 归一化，返回 scanId。</li>
 *   <li>裁剪（{@code scan_suggest_crop_window} -> {@code scan_crop}）与 ROI 积分（{@code scan_extract_roi}/{@code scan_track_roi}）。</li>
 *   <li>按列值定位扫描点（{@code scan_nearest_index}）与单点查看数据（{@code scan_view_point}）。</li>
 * </ul>
 * <p>
 * 安全策略：所有路径都经 {@link SecurePathResolver} 校验，只能读取 {@code app.scan.roots} 白名单内的文件；本服务从不写文件。
 * <p>
 * 内存策略：一次扫描的全部帧常驻内存，由 {@link ScanSessionStore} 按 TTL 与会话上限管理。
 */
@Component
public class ScanMcpTools {

    private static final Logger log = LoggerFactory.getLogger(ScanMcpTools.class);

    private final ScanServerProperties properties;
    private final SecurePathResolver pathResolver;
    private final ScanSessionStore sessionStore;

    public ScanMcpTools(ScanServerProperties properties, SecurePathResolver pathResolver, ScanSessionStore sessionStore) {
        this.properties = properties;
        this.pathResolver = pathResolver;
        this.sessionStore = sessionStore;
    }

    @Tool(
            name = "scan_list_roots",
            description = "列出允许读取扫描数据的根目录（rootId + path）。"
    )
    public DataRootsResult listRoots() {
        return new DataRootsResult(pathResolver.listRoots());
    }

    @Tool(
            name = "scan_list_frames",
            description = "列出帧目录中的原始帧（.raw）与侧车文件（.raw.pdi），按文件名中扩展名前的 4 位序号排序。"
    )
    public FrameListResult listFrames(
            @ToolParam(required = false, description = "rootId（可从 scan_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "帧目录（相对 rootId 或绝对路径）") String folder
    ) {
        SecurePathResolver.ResolvedPath resolved = pathResolver.resolveDirectory(rootId, folder);
        RawFrameStore store = RawFrameStore.of(resolved.absolutePath(), properties);
        return new FrameListResult(resolved.rootId(), resolved.displayPath(), store.listOrdered(), store.listSidecars());
    }

    @Tool(
            name = "scan_read_sidecar",
            description = "解析一个帧侧车文件（.raw.pdi）：电机位置 th/tth/chi/phi/gamma/mu 与探测器标定 PD_X/PD_Y/PD_DIST/PD_ALPHA/PD_DELTA/LAMBDA。"
    )
    public SidecarReadResult readSidecar(
            @ToolParam(required = false, description = "rootId（为空默认 root0）") String rootId,
            @ToolParam(description = "侧车文件路径（相对 rootId 或绝对路径）") String path
    ) {
        SecurePathResolver.ResolvedPath resolved = pathResolver.resolveFile(rootId, path, properties.getSidecarExtension());
        return new SidecarReadResult(resolved.rootId(), resolved.displayPath(), SidecarMetadataParser.parse(resolved.absolutePath()));
    }

    /**
     * 组装一次扫描并登记为会话。
     * <p>
     * 顺序：先校验布局与衰减片系数，再读扫描表、列出帧，最后才逐帧读取；任何一步失败都不会留下会话。
     */
    @Tool(
            name = "scan_assemble",
            description = "组装扫描：读取扫描表 .csv 与帧目录中的全部原始帧（按位置一一对应），计算衰减修正因子 exp(Σ foil_i × c_i) 与归一化帧 raw × attenuation / monitor。返回 scanId 供后续工具使用。"
    )
    public ScanAssembleResult assemble(
            @ToolParam(required = false, description = "rootId（为空默认 root0）") String rootId,
            @ToolParam(description = "扫描表 .csv 路径（相对 rootId 或绝对路径）") String metadataPath,
            @ToolParam(description = "帧目录（相对 rootId 或绝对路径）") String frameFolder,
            @ToolParam(description = "4 片衰减片的系数，例如 [0, 0, 0.1, 0.2]") List<Double> foils,
            @ToolParam(description = "线站布局：72（h,k,l,monitor,foils）或 21（twotheta,theta,monitor,foils,normalized）") String beamline
    ) {
        ScanLayout layout = ScanLayout.fromTag(beamline);
        FoilAttenuation attenuation = new FoilAttenuation(foils);

        SecurePathResolver.ResolvedPath csv = pathResolver.resolveFile(rootId, metadataPath, ".csv");
        SecurePathResolver.ResolvedPath folder = pathResolver.resolveDirectory(rootId, frameFolder);

        MetadataCsvReader.MetadataTable table = MetadataCsvReader.read(csv.absolutePath());
        RawFrameStore store = RawFrameStore.of(folder.absolutePath(), properties);
        List<String> frameIds = store.listOrdered();

        Scan scan = ScanAssembler.assemble(table.rows(), frameIds, store, attenuation, layout);
        ScanSessionStore.ScanSession session = sessionStore.create(csv.rootId(), csv.displayPath(), folder.displayPath(), frameIds, scan);

        List<ScanPointSummary> summaries = new ArrayList<>(scan.size());
        for (ScanPoint point : scan.points()) {
            summaries.add(new ScanPointSummary(
                    point.index(),
                    frameIds.get(point.index()),
                    point.metadata(),
                    point.foilCode(),
                    point.attenuationFactor(),
                    point.rawFrame().sum()
            ));
        }
        return new ScanAssembleResult(
                session.scanId(),
                session.rootId(),
                session.metadataPath(),
                session.frameFolder(),
                layout.name(),
                scan.size(),
                scan.frameRows(),
                scan.frameColumns(),
                scan.columns(),
                summaries,
                session.expiresAt()
        );
    }

    @Tool(
            name = "scan_suggest_crop_window",
            description = "建议裁剪窗口（仅供参考）：所有点归一化帧取平均后沿行求和得到列剖面，以剖面最大值（或指定 center）为中心取宽 window 的窗口，lim 向零截断。"
    )
    public CropWindowResult suggestCropWindow(
            @ToolParam(description = "scanId（来自 scan_assemble）") String scanId,
            @ToolParam(description = "窗口宽度（像素）") Integer window,
            @ToolParam(required = false, description = "可选：显式指定窗口中心列；为空则取剖面最大值位置") Integer center
    ) {
        Scan scan = sessionStore.require(scanId).scan();
        if (window == null) {
            throw new IllegalArgumentException("window 不能为空");
        }
        CropWindow suggestion = Cropper.suggestCropWindow(scan, window, center);

        List<String> warnings = new ArrayList<>();
        List<Double> profile = null;
        if (suggestion.profile().size() <= properties.getMaxProfileValues()) {
            profile = suggestion.profile();
        } else {
            warnings.add("剖面长度 " + suggestion.profile().size() + " 超过 app.scan.max-profile-values，未返回剖面。");
        }
        if (suggestion.lim1() < 0 || suggestion.lim2() > scan.frameColumns()) {
            warnings.add("建议窗口超出帧宽度 " + scan.frameColumns() + "，直接用于 scan_crop 会失败；请缩小 window 或调整 center。");
        }
        return new CropWindowResult(scanId, window, suggestion.center(), suggestion.lim1(), suggestion.lim2(),
                profile, warnings.isEmpty() ? null : warnings);
    }

    @Tool(
            name = "scan_crop",
            description = "按列裁剪扫描中每一帧到 [lim1, lim2)（所有行保留），并记录每帧裁剪后的最大值像素 px_x/px_y。可重复调用，总是基于归一化帧重新裁剪。"
    )
    public CropResult crop(
            @ToolParam(description = "scanId（来自 scan_assemble）") String scanId,
            @ToolParam(description = "列下限（含）") Integer lim1,
            @ToolParam(description = "列上限（不含）") Integer lim2
    ) {
        Scan scan = sessionStore.require(scanId).scan();
        if (lim1 == null || lim2 == null) {
            throw new IllegalArgumentException("lim1/lim2 不能为空");
        }
        Cropper.crop(scan, lim1, lim2);
        CropColumns crop = scan.crop();
        log.debug("扫描 {} 已裁剪到 [{}, {})", scanId, lim1, lim2);

        List<Integer> peakX = new ArrayList<>(scan.size());
        List<Integer> peakY = new ArrayList<>(scan.size());
        for (CroppedPoint point : crop.points()) {
            peakX.add(point.peakX());
            peakY.add(point.peakY());
        }
        return new CropResult(scanId, lim1, lim2, scan.frameRows(), lim2 - lim1, peakX, peakY);
    }

    @Tool(
            name = "scan_extract_roi",
            description = "固定 ROI 积分：在裁剪帧上以 (cenx, ceny) 为中心构造 height×width 的矩形（必须为奇数，且完整落在裁剪帧内），逐点求和。"
    )
    public RoiSignalResult extractRoi(
            @ToolParam(description = "scanId（需已 scan_crop）") String scanId,
            @ToolParam(description = "ROI 水平中心（裁剪帧列坐标）") Integer cenx,
            @ToolParam(description = "ROI 垂直中心（行坐标）") Integer ceny,
            @ToolParam(description = "ROI 高度（正奇数）") Integer height,
            @ToolParam(description = "ROI 宽度（正奇数）") Integer width
    ) {
        Scan scan = sessionStore.require(scanId).scan();
        requireRoiArgs(ceny, height, width);
        if (cenx == null) {
            throw new IllegalArgumentException("cenx 不能为空");
        }
        CropColumns crop = scan.crop();
        int rows = scan.frameRows();
        int columns = crop.lim2() - crop.lim1();
        RoiMask mask = RoiEngine.makeMask(rows, columns, cenx, ceny, height, width);
        double[] signal = RoiEngine.extract(crop, RoiSelection.fixed(mask));
        return new RoiSignalResult(scanId, "fixed", ceny, height, width,
                Collections.nCopies(scan.size(), cenx), boxed(signal));
    }

    @Tool(
            name = "scan_track_roi",
            description = "跟踪 ROI 积分：每个点的 ROI 水平中心取该点的 px_x（最大值像素列），垂直中心与尺寸固定，用于跟随水平漂移的峰。任一点窗口越界会报告该点下标。"
    )
    public RoiSignalResult trackRoi(
            @ToolParam(description = "scanId（需已 scan_crop）") String scanId,
            @ToolParam(description = "ROI 垂直中心（行坐标）") Integer ceny,
            @ToolParam(description = "ROI 高度（正奇数）") Integer height,
            @ToolParam(description = "ROI 宽度（正奇数）") Integer width
    ) {
        Scan scan = sessionStore.require(scanId).scan();
        requireRoiArgs(ceny, height, width);
        CropColumns crop = scan.crop();
        RoiSelection.PerPoint masks = RoiEngine.trackCenter(crop, ceny, height, width);
        double[] signal = RoiEngine.extract(crop, masks);

        List<Integer> centers = new ArrayList<>(masks.masks().size());
        for (RoiMask mask : masks.masks()) {
            centers.add(mask.cenx());
        }
        return new RoiSignalResult(scanId, "tracked", ceny, height, width, centers, boxed(signal));
    }

    @Tool(
            name = "scan_nearest_index",
            description = "在某列中找与目标值最接近的扫描点下标（并列取最小下标）。可用列见 scan_assemble 返回的 columns，例如 l、theta、attenuation、px_x。"
    )
    public NearestIndexResult nearestIndex(
            @ToolParam(description = "scanId（来自 scan_assemble）") String scanId,
            @ToolParam(description = "列名（不区分大小写）") String column,
            @ToolParam(description = "目标值") Double value
    ) {
        Scan scan = sessionStore.require(scanId).scan();
        if (value == null) {
            throw new IllegalArgumentException("value 不能为空");
        }
        int index = scan.nearestIndex(column, value);
        return new NearestIndexResult(scanId, column, value, index, scan.columnValues(column)[index]);
    }

    @Tool(
            name = "scan_view_point",
            description = "返回查看某个扫描点裁剪帧所需的数据：标题（L = ...）、最大值像素、以全部点 px_y 中位数为中心的纵向显示范围。"
    )
    public PointViewResult viewPoint(
            @ToolParam(description = "scanId（需已 scan_crop）") String scanId,
            @ToolParam(description = "扫描下标，从 0 开始") Integer index,
            @ToolParam(required = false, description = "纵向显示半宽（默认 app.scan.view-default-y-width）") Integer yWidth
    ) {
        Scan scan = sessionStore.require(scanId).scan();
        CropColumns crop = scan.crop();
        if (index == null || index < 0 || index >= scan.size()) {
            throw new IllegalArgumentException("扫描下标越界：" + index + "（扫描点数 " + scan.size() + "）");
        }
        int halfHeight = yWidth == null ? properties.getViewDefaultYWidth() : yWidth;
        if (halfHeight <= 0) {
            throw new IllegalArgumentException("yWidth 必须为正：" + halfHeight);
        }

        ScanPoint point = scan.point(index);
        CroppedPoint cropped = crop.point(index);
        double yMedian = median(scan.columnValues(Scan.PEAK_Y));
        return new PointViewResult(
                scanId,
                index,
                titleOf(point),
                cropped.cropFrame().rows(),
                cropped.cropFrame().columns(),
                cropped.peakX(),
                cropped.peakY(),
                cropped.cropFrame().get(cropped.peakY(), cropped.peakX()),
                yMedian,
                yMedian - halfHeight,
                yMedian + halfHeight,
                point.metadata()
        );
    }

    @Tool(
            name = "scan_release",
            description = "释放一个扫描会话（及其常驻内存的全部帧）。"
    )
    public ReleaseResult release(
            @ToolParam(description = "scanId") String scanId
    ) {
        return new ReleaseResult(scanId, sessionStore.remove(scanId));
    }

    private static void requireRoiArgs(Integer ceny, Integer height, Integer width) {
        if (ceny == null || height == null || width == null) {
            throw new IllegalArgumentException("ceny/height/width 不能为空");
        }
    }

    private static List<Double> boxed(double[] values) {
        return Arrays.stream(values).boxed().toList();
    }

    // 标题沿用 “L = ” + 数值字符串前 5 个字符
    static String titleOf(ScanPoint point) {
        Double l = point.metadata().get("l");
        if (l == null) {
            return null;
        }
        String text = String.valueOf(l);
        return "L = " + text.substring(0, Math.min(5, text.length()));
    }

    static double median(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int n = sorted.length;
        if (n == 0) {
            return Double.NaN;
        }
        return n % 2 == 1 ? sorted[n / 2] : (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;
    }
}
