package io.lighting.weave.fragment;

/**
 * 预编译片段的文本已固定，传入的 {@link Fragment} 参数无法再展开。
 */
public class FragmentCompositionException extends IllegalArgumentException {
    private final String slotName;

    public FragmentCompositionException(String slotName) {
        super("Cannot splice a fragment into prepared slot '" + slotName
            + "'; fill or compile the fragment before preparing it");
        this.slotName = slotName;
    }

    public String slotName() {
        return slotName;
    }
}
