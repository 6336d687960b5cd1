package org.treeforge.exception;

import org.treeforge.apply.StructuralMismatch;

import java.util.List;

/**
 * 校验失败：树结构与磁盘不一致（{@link #getMismatch()} 非空），或操作/树规则冲突（{@link #getViolations()}）。
 */
public class TreeValidationException extends TreeForgeException {

    private final List<String> violations;
    private final StructuralMismatch mismatch;

    public TreeValidationException(String message, List<String> violations) {
        super(message);
        this.violations = List.copyOf(violations);
        this.mismatch = null;
    }

    public TreeValidationException(String message, StructuralMismatch mismatch) {
        super(message);
        this.violations = List.of();
        this.mismatch = mismatch;
    }

    public List<String> getViolations() {
        return violations;
    }

    /**
     * 结构不一致时的差异报告；规则冲突时为 null。
     */
    public StructuralMismatch getMismatch() {
        return mismatch;
    }

    public boolean isStructureMismatch() {
        return mismatch != null;
    }
}
