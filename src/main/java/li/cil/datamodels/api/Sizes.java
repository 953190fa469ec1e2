package li.cil.datamodels.api;

/**
 * Constants for different type sizes.
 * <p>
 * Byte widths are named by their bit width, assuming {@link #CHAR_BIT} bits per byte.
 */
public final class Sizes {
    /**
     * Number of bits in a {@code char}, the smallest addressable unit.
     */
    public static final int CHAR_BIT = Byte.SIZE;

    public static final int SIZE_8 = 8;
    public static final int SIZE_16 = 16;
    public static final int SIZE_32 = 32;
    public static final int SIZE_64 = 64;

    public static final int SIZE_8_BYTES = SIZE_8 / CHAR_BIT;
    public static final int SIZE_16_BYTES = SIZE_16 / CHAR_BIT;
    public static final int SIZE_32_BYTES = SIZE_32 / CHAR_BIT;
    public static final int SIZE_64_BYTES = SIZE_64 / CHAR_BIT;

    /**
     * Marks a type that does not exist, or has no specified size, in a data model.
     */
    public static final int UNDEFINED = 0;

    private Sizes() {
    }
}
