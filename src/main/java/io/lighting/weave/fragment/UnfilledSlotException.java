package io.lighting.weave.fragment;

/**
 * 渲染或预编译调用时仍存在未绑定的命名槽位。
 */
public class UnfilledSlotException extends IllegalStateException {
    private final String slotName;

    public UnfilledSlotException(String slotName) {
        super("Unfilled slot: '" + slotName + "'");
        this.slotName = slotName;
    }

    public String slotName() {
        return slotName;
    }
}
