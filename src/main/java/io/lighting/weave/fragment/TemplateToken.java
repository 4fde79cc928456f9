package io.lighting.weave.fragment;

import java.util.Objects;

sealed interface TemplateToken permits TextToken, PositionalToken, NamedToken {
}

record TextToken(String text) implements TemplateToken {
    TextToken {
        Objects.requireNonNull(text, "text");
    }
}

record PositionalToken(int index) implements TemplateToken {
}

record NamedToken(String name) implements TemplateToken {
    NamedToken {
        Objects.requireNonNull(name, "name");
    }
}
