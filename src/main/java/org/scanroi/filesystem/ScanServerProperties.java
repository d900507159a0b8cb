package org.scanroi.filesystem;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * 扫描归约 MCP Server 的业务配置（{@code app.scan.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>通过 {@link #roots} 指定允许访问的数据根目录白名单，扫描表/帧/侧车文件都只能从这些目录读取。</li>
 *   <li>通过 {@link #detectorRows}/{@link #detectorColumns} 声明探测器几何（默认 Pilatus 100K：195×487）。</li>
 *   <li>通过会话 TTL 与上限控制内存占用：一次扫描的全部帧都常驻内存。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.scan")
public class ScanServerProperties {

    /**
     * 允许访问的根目录白名单（自动分配 rootId：root0、root1...）。
     */
    @NotNull
    private List<String> roots = List.of(".");

    /**
     * 是否允许访问符号链接/链接目录（默认不允许，防止路径逃逸）。
     */
    private boolean allowSymlink = false;

    /**
     * 探测器行数。
     */
    @Min(1)
    @Max(100_000)
    private int detectorRows = 195;

    /**
     * 探测器列数。
     */
    @Min(1)
    @Max(100_000)
    private int detectorColumns = 487;

    /**
     * 原始帧文件扩展名。
     */
    @NotBlank
    private String frameExtension = ".raw";

    /**
     * 帧侧车（标定/电机位置）文件扩展名。
     */
    @NotBlank
    private String sidecarExtension = ".raw.pdi";

    /**
     * 扫描会话的有效期；过期后会话被清理，需要重新 {@code scan_assemble}。
     */
    @NotNull
    private Duration sessionTtl = Duration.ofMinutes(30);

    /**
     * 同时保留的扫描会话上限（上限保护）。
     */
    @Min(1)
    @Max(1_000)
    private int maxSessions = 16;

    /**
     * {@code scan_suggest_crop_window} 最多返回多少个剖面值（超过则不返回剖面，只返回窗口）。
     */
    @Min(0)
    @Max(1_000_000)
    private int maxProfileValues = 4_096;

    /**
     * {@code scan_view_point} 默认的纵向显示半宽（像素，以 px_y 中位数为中心）。
     */
    @Min(1)
    @Max(100_000)
    private int viewDefaultYWidth = 40;

    public List<String> getRoots() {
        return roots;
    }

    public void setRoots(List<String> roots) {
        this.roots = roots;
    }

    public boolean isAllowSymlink() {
        return allowSymlink;
    }

    public void setAllowSymlink(boolean allowSymlink) {
        this.allowSymlink = allowSymlink;
    }

    public int getDetectorRows() {
        return detectorRows;
    }

    public void setDetectorRows(int detectorRows) {
        this.detectorRows = detectorRows;
    }

    public int getDetectorColumns() {
        return detectorColumns;
    }

    public void setDetectorColumns(int detectorColumns) {
        this.detectorColumns = detectorColumns;
    }

    public String getFrameExtension() {
        return frameExtension;
    }

    public void setFrameExtension(String frameExtension) {
        this.frameExtension = frameExtension;
    }

    public String getSidecarExtension() {
        return sidecarExtension;
    }

    public void setSidecarExtension(String sidecarExtension) {
        this.sidecarExtension = sidecarExtension;
    }

    public Duration getSessionTtl() {
        return sessionTtl;
    }

    public void setSessionTtl(Duration sessionTtl) {
        this.sessionTtl = sessionTtl;
    }

    public int getMaxSessions() {
        return maxSessions;
    }

    public void setMaxSessions(int maxSessions) {
        this.maxSessions = maxSessions;
    }

    public int getMaxProfileValues() {
        return maxProfileValues;
    }

    public void setMaxProfileValues(int maxProfileValues) {
        this.maxProfileValues = maxProfileValues;
    }

    public int getViewDefaultYWidth() {
        return viewDefaultYWidth;
    }

    public void setViewDefaultYWidth(int viewDefaultYWidth) {
        this.viewDefaultYWidth = viewDefaultYWidth;
    }
}
