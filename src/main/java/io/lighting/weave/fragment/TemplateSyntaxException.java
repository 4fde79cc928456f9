package io.lighting.weave.fragment;

public class TemplateSyntaxException extends IllegalArgumentException {
    private final int position;

    public TemplateSyntaxException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int position() {
        return position;
    }
}
