package org.lambdabatch.grouping;

/**
 * Detector tile a raw file belongs to. Declaration order is the order members take inside a file set.
 */
public enum ModuleTag {
    NONE("none"),
    MODULE_1("module-1"),
    MODULE_2("module-2"),
    MODULE_3("module-3");

    private final String label;

    ModuleTag(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ModuleTag ofIndex(int index) {
        return switch (index) {
            case 1 -> MODULE_1;
            case 2 -> MODULE_2;
            case 3 -> MODULE_3;
            default -> throw new IllegalArgumentException("No detector module " + index);
        };
    }

    @Override
    public String toString() {
        return label;
    }
}
