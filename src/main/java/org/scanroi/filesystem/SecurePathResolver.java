package org.scanroi.filesystem;

import org.scanroi.filesystem.dto.DataRoot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 数据路径解析器：把调用方传入的扫描表/帧目录/侧车文件路径解析成受控的绝对路径，并确保不逃逸出 {@code app.scan.roots}。
 * <p>
 * 规则：
 * <ul>
 *   <li>绝对路径：匹配层级最长的 root；相对路径：从 rootId 指定的 root 解析，rootId 为空时默认 root0。</li>
 *   <li>阻止 {@code ../} 穿越；默认禁止符号链接（symlink）与 junction 造成的逃逸，逐级做 realPath 校验。</li>
 *   <li>这里只读不写，所以目标必须已经存在。</li>
 * </ul>
 */
public class SecurePathResolver {

    private final ScanServerProperties properties;
    private final List<Root> roots;

    public SecurePathResolver(ScanServerProperties properties) {
        this.properties = properties;
        this.roots = normalizeRoots(properties);
    }

    public List<DataRoot> listRoots() {
        List<DataRoot> result = new ArrayList<>(roots.size());
        for (Root root : roots) {
            result.add(new DataRoot(root.id(), root.rootPath().toString()));
        }
        return result;
    }

    /**
     * 解析一个已存在的目录（例如帧目录）。
     */
    public ResolvedPath resolveDirectory(String rootId, String inputPath) {
        ResolvedPath resolved = resolve(rootId, inputPath);
        if (!Files.isDirectory(resolved.absolutePath(), LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("不是目录：" + resolved.displayPath());
        }
        return resolved;
    }

    /**
     * 解析一个已存在的普通文件，并校验扩展名（不区分大小写；suffix 为空则不校验）。
     */
    public ResolvedPath resolveFile(String rootId, String inputPath, String suffix) {
        ResolvedPath resolved = resolve(rootId, inputPath);
        Path file = resolved.absolutePath();
        if (!Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("不是普通文件：" + resolved.displayPath());
        }
        if (suffix != null && !suffix.isBlank()) {
            String name = file.getFileName() == null ? "" : file.getFileName().toString();
            if (!name.toLowerCase(Locale.ROOT).endsWith(suffix.toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException("文件扩展名不是 " + suffix + "：" + resolved.displayPath());
            }
        }
        return resolved;
    }

    public ResolvedPath resolve(String rootId, String inputPath) {
        if (roots.isEmpty()) {
            throw new IllegalStateException("未配置允许访问的根目录（app.scan.roots）");
        }

        Path rawPath = (inputPath == null || inputPath.isBlank()) ? null : Path.of(inputPath);
        Root selectedRoot;
        Path absolute;

        if (rawPath != null && rawPath.isAbsolute()) {
            absolute = rawPath.toAbsolutePath().normalize();
            selectedRoot = (rootId == null || rootId.isBlank()) ? findBestRootForAbsolute(absolute) : findRootById(rootId);
        } else {
            selectedRoot = (rootId == null || rootId.isBlank()) ? roots.get(0) : findRootById(rootId);
            absolute = (rawPath == null) ? selectedRoot.rootPath() : selectedRoot.rootPath().resolve(rawPath).normalize();
        }

        // 字符串层面的 startsWith 先挡掉明显越界的路径
        if (!absolute.startsWith(selectedRoot.rootPath())) {
            throw new IllegalArgumentException("路径不在允许访问的根目录范围内：" + inputPath);
        }
        if (!Files.exists(absolute, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("路径不存在：" + absolute);
        }
        validateWithinRoot(selectedRoot, absolute);

        return new ResolvedPath(selectedRoot.id(), absolute, displayPath(selectedRoot, absolute));
    }

    private void validateWithinRoot(Root root, Path absolute) {
        Path rootReal;
        try {
            rootReal = root.rootPath().toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException("根目录不存在或无法解析：" + root.rootPath(), e);
        }

        // root -> 目标 的每一级都做 realPath 校验，中间任何一级是链接都可能导致逃逸
        Path current = root.rootPath();
        for (Path segment : root.rootPath().relativize(absolute)) {
            current = current.resolve(segment);
            if (!properties.isAllowSymlink() && Files.isSymbolicLink(current)) {
                throw new IllegalArgumentException("不允许访问符号链接路径：" + current);
            }
            try {
                if (!current.toRealPath().startsWith(rootReal)) {
                    throw new IllegalArgumentException("路径通过链接/junction 逃逸出根目录：" + current);
                }
            } catch (IOException e) {
                throw new IllegalArgumentException("路径无法解析：" + current, e);
            }
        }
    }

    private Root findRootById(String rootId) {
        for (Root root : roots) {
            if (root.id().equals(rootId)) {
                return root;
            }
        }
        throw new IllegalArgumentException("未知的 rootId：" + rootId);
    }

    private Root findBestRootForAbsolute(Path absolute) {
        return roots.stream()
                .filter(r -> absolute.startsWith(r.rootPath()))
                .max(Comparator.comparingInt(r -> r.rootPath().getNameCount()))
                .orElseThrow(() -> new IllegalArgumentException("路径不在允许访问的根目录范围内：" + absolute));
    }

    private static List<Root> normalizeRoots(ScanServerProperties properties) {
        List<String> configured = properties.getRoots();
        if (configured == null || configured.isEmpty()) {
            return List.of();
        }
        List<Root> result = new ArrayList<>(configured.size());
        for (int i = 0; i < configured.size(); i++) {
            String value = Objects.requireNonNull(configured.get(i), "配置项 app.scan.roots[" + i + "] 不能为空");
            result.add(new Root("root" + i, Path.of(value).toAbsolutePath().normalize()));
        }
        return result;
    }

    private static String displayPath(Root root, Path absolute) {
        String relative = root.rootPath().relativize(absolute).toString();
        return relative.replace('\\', '/');
    }

    private record Root(String id, Path rootPath) {
    }

    public record ResolvedPath(String rootId, Path absolutePath, String displayPath) {
    }
}
