package com.nodeforge.plugin;

/** Thrown when a category name is not one of the fixed plugin categories. */
public final class CategoryException extends PluginException {

    private static final long serialVersionUID = 1L;

    private final String category;

    public CategoryException(String category) {
        super(String.format("CategoryError: unknown plugin category '%s'", category));
        this.category = category;
    }

    public String getCategory() {
        return category;
    }
}
