package io.reviewdeck.core.deck;

import java.io.IOException;
import java.nio.file.Path;

public final class TemplateNotFoundException extends IOException {
    private final Path template;

    public TemplateNotFoundException(Path template, String message) {
        super(message);
        this.template = template;
    }

    public TemplateNotFoundException(Path template, String message, Throwable cause) {
        super(message, cause);
        this.template = template;
    }

    public Path template() {
        return template;
    }
}
