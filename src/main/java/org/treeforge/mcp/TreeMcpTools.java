package org.treeforge.mcp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;
import org.treeforge.apply.ApplyPlan;
import org.treeforge.apply.OperationRecord;
import org.treeforge.apply.StructuralMismatch;
import org.treeforge.apply.TreeForgePipeline;
import org.treeforge.exception.OperationExecutionException;
import org.treeforge.exception.PathSafetyException;
import org.treeforge.exception.SessionBusyException;
import org.treeforge.exception.TreeForgeException;
import org.treeforge.exception.TreeParseException;
import org.treeforge.exception.TreeValidationException;
import org.treeforge.filesystem.SecurePathResolver;
import org.treeforge.filesystem.TreeForgeProperties;
import org.treeforge.filesystem.dto.AllowedRootsResult;
import org.treeforge.filesystem.dto.OperationView;
import org.treeforge.filesystem.dto.SessionCloseResult;
import org.treeforge.filesystem.dto.TreeApplyResult;
import org.treeforge.filesystem.dto.TreeGenerateResult;
import org.treeforge.filesystem.dto.TreePreviewResult;
import org.treeforge.session.SessionState;
import org.treeforge.session.TreeSessionStore;
import org.treeforge.tree.ParseProblem;
import org.treeforge.tree.TreePath;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 目录树 MCP 工具集合。
 * <p>
 * 工作流：
 * <ol>
 *   <li>{@code tree_generate}：扫描目录，返回可编辑的树形文本与 sessionId。</li>
 *   <li>用户在文本中添加标记：{@code [+]} 新建、{@code [-]} 删除、{@code [~ 新名称]} 重命名。</li>
 *   <li>{@code tree_preview}：校验并返回将要执行的变更（不修改磁盘）。</li>
 *   <li>{@code tree_apply}：确认后按安全顺序执行变更。</li>
 * </ol>
 * <p>
 * 安全策略：
 * <ul>
 *   <li>仅允许操作 {@code tree-forge.roots} 白名单目录范围内的路径。</li>
 *   <li>文本描述的现状必须与磁盘完全一致才会执行（结构闸门）。</li>
 *   <li>默认必须显式 {@code confirm=true} 才会执行（{@code tree-forge.confirm-before-apply}）。</li>
 * </ul>
 */
@Component
public class TreeMcpTools {

    private static final Logger logger = LoggerFactory.getLogger(TreeMcpTools.class);

    private final TreeForgeProperties properties;
    private final SecurePathResolver pathResolver;
    private final TreeSessionStore sessions;
    private final TreeForgePipeline pipeline;

    public TreeMcpTools(
            TreeForgeProperties properties,
            SecurePathResolver pathResolver,
            TreeSessionStore sessions,
            TreeForgePipeline pipeline
    ) {
        this.properties = properties;
        this.pathResolver = pathResolver;
        this.sessions = sessions;
        this.pipeline = pipeline;
    }

    @Tool(
            name = "tree_list_roots",
            description = "列出允许操作的根目录（rootId + path）。"
    )
    public AllowedRootsResult listRoots() {
        return new AllowedRootsResult(pathResolver.listRoots());
    }

    @Tool(
            name = "tree_generate",
            description = "扫描目录并生成可编辑的树形文本（打开一个会话，返回 sessionId）。在文本行尾添加 [+] 新建、[-] 删除、[~ 新名称] 重命名，然后调用 tree_preview / tree_apply。"
    )
    public TreeGenerateResult generate(
            @ToolParam(required = false, description = "rootId（可从 tree_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(required = false, description = "目录路径（相对 rootId 或绝对路径；为空则为根目录）") String path
    ) {
        return toGenerateResult(pipeline.generate(rootId, path));
    }

    @Tool(
            name = "tree_preview",
            description = "预览带标记的树形文本将产生的变更（按执行顺序）；只做解析与校验，不修改磁盘。"
    )
    /**
     * 预览变更。
     * <p>
     * 解析错误、结构不一致、路径越界以及会话忙都以 {@code valid=false} 返回，方便调用方修改文本或稍后重试。
     */
    public TreePreviewResult preview(
            @ToolParam(description = "tree_generate 返回的 sessionId") String sessionId,
            @ToolParam(description = "编辑后的树形文本") String text
    ) {
        try {
            ApplyPlan plan = pipeline.preview(sessionId, text);
            return new TreePreviewResult(
                    sessionId,
                    true,
                    toViews(plan.operations()),
                    plan.summary(),
                    List.of(),
                    plan.warnings().isEmpty() ? null : plan.warnings()
            );
        } catch (TreeParseException | TreeValidationException | PathSafetyException | SessionBusyException e) {
            return new TreePreviewResult(sessionId, false, List.of(), e.getMessage(), describeProblems(e), null);
        }
    }

    @Tool(
            name = "tree_apply",
            description = "执行带标记的树形文本所描述的变更：confirm=true 才会真正修改磁盘；confirm=false 只返回当前基线。中途失败时返回部分成功信息（已生效的变更不会回滚）。"
    )
    /**
     * 应用变更（真正修改磁盘）。
     * <p>
     * 执行前会重新解析、重新比对磁盘并重新调度，不依赖之前的预览结果。
     * 被拒绝的文本与 {@code tree_preview} 一样以结果返回（{@code applied=false}，{@code problems} 逐条列出），磁盘不变。
     */
    public TreeApplyResult apply(
            @ToolParam(description = "tree_generate 返回的 sessionId") String sessionId,
            @ToolParam(description = "编辑后的树形文本") String text,
            @ToolParam(required = false, description = "是否确认执行（默认 false）") Boolean confirm
    ) {
        if (!properties.isAllowWrite()) {
            throw new IllegalStateException("当前服务端配置禁止写入（tree-forge.allow-write=false）");
        }
        boolean confirmed = Boolean.TRUE.equals(confirm);
        if (!confirmed && properties.isConfirmBeforeApply()) {
            SessionState state = sessions.get(sessionId);
            return new TreeApplyResult(
                    sessionId,
                    false,
                    false,
                    false,
                    List.of(),
                    null,
                    List.of(),
                    null,
                    state.baselineText(),
                    List.of(),
                    null,
                    List.of("未执行（confirm=false）；请先用 tree_preview 确认变更，再以 confirm=true 调用")
            );
        }

        try {
            TreeForgePipeline.AppliedChanges applied = pipeline.apply(sessionId, text);
            return new TreeApplyResult(
                    sessionId,
                    true,
                    true,
                    false,
                    toViews(applied.report().executed()),
                    null,
                    List.of(),
                    null,
                    applied.session().baselineText(),
                    List.of(),
                    Instant.now(),
                    applied.warnings().isEmpty() ? null : applied.warnings()
            );
        } catch (TreeParseException | TreeValidationException | PathSafetyException | SessionBusyException e) {
            return new TreeApplyResult(
                    sessionId,
                    true,
                    false,
                    false,
                    List.of(),
                    null,
                    List.of(),
                    e.getMessage(),
                    currentBaselineText(sessionId),
                    describeProblems(e),
                    null,
                    null
            );
        } catch (OperationExecutionException e) {
            logger.warn("会话 {} 部分应用：已完成 {} 条，失败 1 条，未尝试 {} 条",
                    sessionId, e.getCompleted().size(), e.getRemaining().size());
            return new TreeApplyResult(
                    sessionId,
                    true,
                    false,
                    true,
                    toViews(e.getCompleted()),
                    OperationView.of(e.getFailed()),
                    toViews(e.getRemaining()),
                    e.getMessage(),
                    currentBaselineText(sessionId),
                    List.of(),
                    Instant.now(),
                    partialFailureWarnings(e)
            );
        }
    }

    @Tool(
            name = "tree_accept_live_baseline",
            description = "放弃会话中的旧基线，以磁盘现状作为新基线（结构校验不通过时使用）；返回新的树形文本。"
    )
    public TreeGenerateResult acceptLiveBaseline(
            @ToolParam(description = "tree_generate 返回的 sessionId") String sessionId
    ) {
        return toGenerateResult(pipeline.acceptLiveBaseline(sessionId));
    }

    @Tool(
            name = "tree_close_session",
            description = "关闭会话并丢弃其基线。"
    )
    public SessionCloseResult closeSession(
            @ToolParam(description = "tree_generate 返回的 sessionId") String sessionId
    ) {
        return new SessionCloseResult(sessionId, sessions.close(sessionId));
    }

    /**
     * 把可修正的拒绝原因整理成逐条问题，预览和应用共用。
     */
    private List<String> describeProblems(TreeForgeException e) {
        if (e instanceof TreeParseException parseFailure) {
            List<String> problems = new ArrayList<>();
            for (ParseProblem problem : parseFailure.getProblems()) {
                problems.add(problem.describe());
            }
            return problems;
        }
        if (e instanceof TreeValidationException validationFailure) {
            return describeViolations(validationFailure);
        }
        return List.of(e.getMessage());
    }

    private static List<String> partialFailureWarnings(OperationExecutionException e) {
        List<String> warnings = new ArrayList<>();
        warnings.add("已生效的变更不会回滚");
        if (e.getSuppressed().length == 0) {
            warnings.add("基线已按磁盘现状刷新");
        }
        for (Throwable refreshFailure : e.getSuppressed()) {
            warnings.add(TreeForgePipeline.REFRESH_FAILED + refreshFailure.getMessage());
        }
        return warnings;
    }

    /**
     * 会话已被关闭或过期时返回 null（结果中不再附带基线）。
     */
    private String currentBaselineText(String sessionId) {
        try {
            return sessions.get(sessionId).baselineText();
        } catch (IllegalArgumentException e) {
            logger.debug("读取会话基线失败：{}", e.getMessage());
            return null;
        }
    }

    private List<String> describeViolations(TreeValidationException e) {
        if (!e.isStructureMismatch()) {
            return e.getViolations();
        }
        StructuralMismatch mismatch = e.getMismatch();
        int limit = properties.getMismatchReportLimit();
        List<String> problems = new ArrayList<>();
        appendPaths(problems, "磁盘上新增：", mismatch.added(), limit);
        appendPaths(problems, "磁盘上缺失：", mismatch.removed(), limit);
        return problems;
    }

    private static void appendPaths(List<String> problems, String prefix, List<TreePath> paths, int limit) {
        int shown = Math.min(limit, paths.size());
        for (int i = 0; i < shown; i++) {
            problems.add(prefix + paths.get(i));
        }
        if (paths.size() > shown) {
            problems.add(prefix + "... 以及另外 " + (paths.size() - shown) + " 项");
        }
    }

    private static TreeGenerateResult toGenerateResult(TreeForgePipeline.GeneratedTree generated) {
        SessionState state = generated.session();
        return new TreeGenerateResult(
                state.sessionId(),
                state.rootId(),
                state.displayPath(),
                state.baselineText(),
                generated.nodeCount(),
                generated.warnings().isEmpty() ? null : generated.warnings()
        );
    }

    private static List<OperationView> toViews(List<OperationRecord> records) {
        List<OperationView> views = new ArrayList<>(records.size());
        for (OperationRecord record : records) {
            views.add(OperationView.of(record));
        }
        return views;
    }
}
