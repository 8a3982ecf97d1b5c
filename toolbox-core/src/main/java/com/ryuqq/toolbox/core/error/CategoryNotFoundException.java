package com.ryuqq.toolbox.core.error;

/**
 * 카테고리를 찾을 수 없음.
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public class CategoryNotFoundException extends CatalogException {

    private final String categoryName;

    public CategoryNotFoundException(String categoryName) {
        super(ErrorKind.NOT_FOUND, "Category not found: " + categoryName);
        this.categoryName = categoryName;
    }

    public String categoryName() {
        return categoryName;
    }
}
