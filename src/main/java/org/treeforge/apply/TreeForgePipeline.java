package org.treeforge.apply;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treeforge.exception.OperationExecutionException;
import org.treeforge.exception.TreeValidationException;
import org.treeforge.filesystem.FilesystemProvider;
import org.treeforge.filesystem.FilesystemScanner;
import org.treeforge.filesystem.IgnorePatterns;
import org.treeforge.filesystem.NioFilesystemProvider;
import org.treeforge.filesystem.SecurePathResolver;
import org.treeforge.filesystem.TreeForgeProperties;
import org.treeforge.session.SessionState;
import org.treeforge.session.TreeSessionStore;
import org.treeforge.tree.Operation;
import org.treeforge.tree.Tree;
import org.treeforge.tree.TreeParser;
import org.treeforge.tree.TreePath;
import org.treeforge.tree.TreeSerializer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 生成 / 预览 / 应用 的完整流程。
 * <ol>
 *   <li>{@link #generate}：扫描声明根目录，生成未标记的树形文本并打开会话。</li>
 *   <li>{@link #preview}：解析 -> 与磁盘比对（闸门） -> 提取 -> 调度，不修改磁盘。</li>
 *   <li>{@link #apply}：预览的全部步骤 + 执行；无论成功还是部分失败，都重新扫描并替换会话基线。</li>
 *   <li>{@link #acceptLiveBaseline}：放弃旧基线，直接以磁盘现状为新基线。</li>
 * </ol>
 */
public class TreeForgePipeline {

    private static final Logger logger = LoggerFactory.getLogger(TreeForgePipeline.class);

    /**
     * 变更已执行、但重新扫描失败时的告警前缀；此时会话仍保留旧基线，需要调用接受磁盘现状或重新生成。
     */
    public static final String REFRESH_FAILED = "变更已写入磁盘，但刷新基线失败（会话仍为旧基线，请重新生成或接受磁盘现状）：";

    private final SecurePathResolver pathResolver;
    private final TreeSessionStore sessions;
    private final TreeForgeProperties properties;
    private final FilesystemScanner scanner;
    private final ApplyExecutor executor = new ApplyExecutor();

    public TreeForgePipeline(SecurePathResolver pathResolver, TreeSessionStore sessions, TreeForgeProperties properties) {
        this.pathResolver = pathResolver;
        this.sessions = sessions;
        this.properties = properties;
        this.scanner = new FilesystemScanner(
                new IgnorePatterns(properties.getIgnorePatterns()),
                properties.getScanMaxEntries()
        );
    }

    public GeneratedTree generate(String rootId, String path) {
        SecurePathResolver.ResolvedPath resolved = pathResolver.resolve(rootId, path);
        FilesystemScanner.ScanResult scan = scan(resolved.absolutePath());
        String text = TreeSerializer.render(scan.tree(), scan.tree().root().name());
        SessionState state = sessions.open(
                resolved.rootId(),
                resolved.displayPath(),
                resolved.absolutePath(),
                scan.tree(),
                text
        );
        return new GeneratedTree(state, scan.tree().size() - 1, scan.warnings());
    }

    public ApplyPlan preview(String sessionId, String text) {
        SessionState state = sessions.beginOperation(sessionId);
        try {
            return plan(state, text);
        } finally {
            sessions.endOperation(sessionId);
        }
    }

    /**
     * 应用变更。部分失败时同样刷新基线，然后原样抛出 {@link OperationExecutionException}。
     * <p>
     * 变更已经落盘后，刷新基线失败（例如超出扫描上限）不再改变结果：成功时记为告警并保留旧基线，
     * 部分失败时作为 suppressed 异常附在原异常上。
     */
    public AppliedChanges apply(String sessionId, String text) {
        SessionState state = sessions.beginOperation(sessionId);
        try {
            ApplyPlan plan = plan(state, text);
            FilesystemProvider provider = providerFor(state.rootPath());
            logger.info("会话 {} 开始应用 {} 条变更：{}", sessionId, plan.operations().size(), state.rootPath());
            ApplyReport report;
            try {
                report = executor.execute(plan.operations(), provider, false);
            } catch (OperationExecutionException e) {
                try {
                    refreshBaseline(state);
                } catch (RuntimeException refreshFailure) {
                    logger.warn("会话 {} 部分失败后刷新基线失败：{}", sessionId, refreshFailure.getMessage());
                    e.addSuppressed(refreshFailure);
                }
                throw e;
            }
            List<String> warnings = new ArrayList<>(plan.warnings());
            SessionState updated;
            try {
                updated = refreshBaseline(state);
            } catch (RuntimeException refreshFailure) {
                logger.warn("会话 {} 应用成功但刷新基线失败：{}", sessionId, refreshFailure.getMessage());
                warnings.add(REFRESH_FAILED + refreshFailure.getMessage());
                updated = state;
            }
            logger.info("会话 {} 应用完成，共 {} 条变更", sessionId, report.count());
            return new AppliedChanges(plan, report, updated, warnings);
        } finally {
            sessions.endOperation(sessionId);
        }
    }

    public GeneratedTree acceptLiveBaseline(String sessionId) {
        SessionState state = sessions.beginOperation(sessionId);
        try {
            FilesystemScanner.ScanResult scan = scan(state.rootPath());
            String text = TreeSerializer.render(scan.tree(), scan.tree().root().name());
            SessionState updated = sessions.replace(sessionId, scan.tree(), text);
            logger.info("会话 {} 已接受磁盘现状为新基线", sessionId);
            return new GeneratedTree(updated, scan.tree().size() - 1, scan.warnings());
        } finally {
            sessions.endOperation(sessionId);
        }
    }

    /**
     * 把变更列表整理成分组文本：新建、重命名、删除（组内保持执行顺序）。
     */
    public static String formatOperations(List<OperationRecord> records) {
        if (records.isEmpty()) {
            return "没有需要执行的变更。\n";
        }
        StringBuilder out = new StringBuilder();
        appendGroup(out, "新建", records, Operation.CREATE);
        appendGroup(out, "重命名", records, Operation.RENAME);
        appendGroup(out, "删除", records, Operation.DELETE);
        return out.toString();
    }

    protected FilesystemProvider providerFor(Path rootPath) {
        return new NioFilesystemProvider(rootPath, pathResolver);
    }

    private ApplyPlan plan(SessionState state, String text) {
        Tree declared = TreeParser.parseOrThrow(text);

        FilesystemScanner.ScanResult scan = scan(state.rootPath());
        List<TreePath> actual = scan.paths();
        List<String> warnings = new ArrayList<>(scan.warnings());

        StructuralMismatch drift = StructureValidator.drift(state.baseline(), actual);
        if (!drift.isEmpty()) {
            warnings.add("磁盘在上次生成/应用之后被外部修改（新增 " + drift.added().size()
                    + "，缺失 " + drift.removed().size() + "）");
        }

        StructureCheckResult check = StructureValidator.validate(declared, actual);
        if (!check.valid()) {
            logger.warn("会话 {} 结构校验未通过：新增 {}，缺失 {}",
                    state.sessionId(), check.mismatch().added().size(), check.mismatch().removed().size());
            throw new TreeValidationException(
                    StructureValidator.formatMismatch(check.mismatch(), properties.getMismatchReportLimit()),
                    check.mismatch()
            );
        }

        List<OperationRecord> records = OperationExtractor.extractAndValidate(declared);
        List<OperationRecord> ordered = ApplyScheduler.schedule(records, state.rootPath());
        ApplyReport dryRun = executor.execute(ordered, providerFor(state.rootPath()), true);
        return new ApplyPlan(dryRun.executed(), warnings, formatOperations(dryRun.executed()));
    }

    private SessionState refreshBaseline(SessionState state) {
        FilesystemScanner.ScanResult scan = scan(state.rootPath());
        String text = TreeSerializer.render(scan.tree(), scan.tree().root().name());
        return sessions.replace(state.sessionId(), scan.tree(), text);
    }

    private FilesystemScanner.ScanResult scan(Path rootPath) {
        Path fileName = rootPath.getFileName();
        String rootName = fileName == null ? Tree.DEFAULT_ROOT_NAME : fileName.toString();
        try {
            return scanner.scan(providerFor(rootPath), rootName);
        } catch (IOException e) {
            throw new IllegalStateException("扫描目录失败：" + rootPath + "（" + e.getMessage() + "）", e);
        }
    }

    private static void appendGroup(StringBuilder out, String title, List<OperationRecord> records, Operation operation) {
        List<OperationRecord> group = new ArrayList<>();
        for (OperationRecord record : records) {
            if (record.operation() == operation) {
                group.add(record);
            }
        }
        if (group.isEmpty()) {
            return;
        }
        out.append(title).append("（").append(group.size()).append("）：\n");
        for (OperationRecord record : group) {
            out.append("  ").append(record.describe()).append('\n');
        }
    }

    /**
     * 生成（或重新接受）基线的结果。
     *
     * @param session   会话状态（含基线文本）
     * @param nodeCount 树中节点数（不含根）
     * @param warnings  扫描告警
     */
    public record GeneratedTree(SessionState session, int nodeCount, List<String> warnings) {
    }

    /**
     * 应用成功的结果。
     *
     * @param plan    执行前的计划
     * @param report  执行报告
     * @param session  刷新基线后的会话状态（刷新失败时为旧状态）
     * @param warnings 计划告警以及刷新基线失败的告警
     */
    public record AppliedChanges(ApplyPlan plan, ApplyReport report, SessionState session, List<String> warnings) {
    }
}
