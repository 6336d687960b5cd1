package org.treeforge.apply;

/**
 * 结构校验结果。
 *
 * @param valid    是否一致
 * @param mismatch 不一致时的差异报告；一致时为 null
 */
public record StructureCheckResult(
        boolean valid,
        StructuralMismatch mismatch
) {

    public static StructureCheckResult ok() {
        return new StructureCheckResult(true, null);
    }

    public static StructureCheckResult mismatched(StructuralMismatch mismatch) {
        return new StructureCheckResult(false, mismatch);
    }
}
