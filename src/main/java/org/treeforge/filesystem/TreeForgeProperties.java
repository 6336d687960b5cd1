package org.treeforge.filesystem;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * TreeForge MCP Server 的业务配置（{@code tree-forge.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>通过 {@link #roots} 指定允许操作的根目录白名单，生成树与应用变更都只能发生在这些目录内。</li>
 *   <li>{@link #ignorePatterns} 只在扫描磁盘（生成树、计算磁盘现状）时生效，解析器与调度器不理会它。</li>
 *   <li>{@link #allowSymlink} 默认关闭，防止通过符号链接逃逸出根目录。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "tree-forge")
public class TreeForgeProperties {

    /**
     * 允许操作的根目录白名单；每个 root 自动分配 {@code rootId}（root0、root1...）。
     */
    @NotNull
    private List<String> roots = List.of(".");

    /**
     * 扫描时忽略的名称或通配符（glob，例如 {@code *.log}）。
     * <p>
     * 不含 {@code /} 的模式逐段匹配名称；含 {@code /} 的模式匹配完整相对路径。
     */
    @NotNull
    private List<String> ignorePatterns = List.of(".git", "node_modules", ".DS_Store");

    /**
     * 是否允许真正写入磁盘；关闭后只能预览。
     */
    private boolean allowWrite = true;

    /**
     * 是否允许符号链接出现在操作路径上（默认不允许）。
     */
    private boolean allowSymlink = false;

    /**
     * {@code tree_apply} 是否必须显式传入 {@code confirm=true}。
     */
    private boolean confirmBeforeApply = true;

    /**
     * 会话（基线）在无操作后的有效期。
     */
    @NotNull
    private Duration sessionTtl = Duration.ofMinutes(30);

    /**
     * 同时保留的最大会话数（上限保护）。
     */
    @Min(1)
    @Max(10_000)
    private int maxSessions = 64;

    /**
     * 单次扫描允许的最大条目数。
     * <p>
     * 超过上限直接失败而不是截断：截断后的磁盘现状会让结构校验得出错误结论。
     */
    @Min(1)
    @Max(10_000_000)
    private int scanMaxEntries = 50_000;

    /**
     * 结构差异报告中每一侧最多列出的条目数。
     */
    @Min(1)
    @Max(10_000)
    private int mismatchReportLimit = 10;

    public List<String> getRoots() {
        return roots;
    }

    public void setRoots(List<String> roots) {
        this.roots = roots;
    }

    public List<String> getIgnorePatterns() {
        return ignorePatterns;
    }

    public void setIgnorePatterns(List<String> ignorePatterns) {
        this.ignorePatterns = ignorePatterns;
    }

    public boolean isAllowWrite() {
        return allowWrite;
    }

    public void setAllowWrite(boolean allowWrite) {
        this.allowWrite = allowWrite;
    }

    public boolean isAllowSymlink() {
        return allowSymlink;
    }

    public void setAllowSymlink(boolean allowSymlink) {
        this.allowSymlink = allowSymlink;
    }

    public boolean isConfirmBeforeApply() {
        return confirmBeforeApply;
    }

    public void setConfirmBeforeApply(boolean confirmBeforeApply) {
        this.confirmBeforeApply = confirmBeforeApply;
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

    public int getScanMaxEntries() {
        return scanMaxEntries;
    }

    public void setScanMaxEntries(int scanMaxEntries) {
        this.scanMaxEntries = scanMaxEntries;
    }

    public int getMismatchReportLimit() {
        return mismatchReportLimit;
    }

    public void setMismatchReportLimit(int mismatchReportLimit) {
        this.mismatchReportLimit = mismatchReportLimit;
    }
}
