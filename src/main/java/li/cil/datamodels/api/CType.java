package li.cil.datamodels.api;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Optional;

/**
 * The C types whose size can be looked up in a {@link DataModel}.
 * <p>
 * The C standard only fixes minimum widths for these; the exact width is up to the data model.
 */
public enum CType {
    /**
     * The {@code char} type. Smallest addressable unit of the machine, {@link Sizes#CHAR_BIT} bits wide.
     * <p>
     * Objects of any other integer type are {@code n * CHAR_BIT} bits, where {@code n} is their size in bytes.
     */
    CHAR("char", Sizes.SIZE_8),
    /**
     * The {@code short} type. At least 16 bits.
     */
    SHORT("short", Sizes.SIZE_16),
    /**
     * The {@code int} type. At least 16 bits.
     */
    INT("int", Sizes.SIZE_16),
    /**
     * The {@code long} type. At least 32 bits.
     */
    LONG("long", Sizes.SIZE_32),
    /**
     * The {@code long long} type. At least 64 bits.
     */
    LONG_LONG("long long", Sizes.SIZE_64),
    /**
     * Data pointers, and with them {@code size_t}. At least 16 bits.
     */
    POINTER("void *", Sizes.SIZE_16),
    ;

    private static final Logger LOGGER = LogManager.getLogger();

    private static final HashMap<String, CType> BY_KEYWORD = initializeMap();

    private final String keyword;
    private final int minimumBits;

    CType(final String keyword, final int minimumBits) {
        this.keyword = keyword;
        this.minimumBits = minimumBits;
    }

    /**
     * The C spelling of this type, e.g. {@code long long}.
     *
     * @return the keyword of this type.
     */
    public String keyword() {
        return keyword;
    }

    /**
     * The minimum width the C standard requires for this type.
     *
     * @return the minimum number of bits.
     */
    public int minimumBits() {
        return minimumBits;
    }

    /**
     * Looks up a type by its C spelling.
     * <p>
     * Runs of whitespace are collapsed before matching, so {@code "long  long"} and
     * {@code "void*"} are both accepted.
     *
     * @param keyword the C spelling of the type.
     * @return the type, if the keyword names one.
     */
    @Nonnull
    public static Optional<CType> byKeyword(@Nullable final String keyword) {
        final String normalized = normalize(keyword);
        final CType type = BY_KEYWORD.get(normalized);
        if (type == null) {
            LOGGER.debug("No C type for keyword [{}].", keyword);
        }
        return Optional.ofNullable(type);
    }

    private static String normalize(@Nullable final String keyword) {
        final String collapsed = StringUtils.normalizeSpace(StringUtils.defaultString(keyword));
        // Pointer spelling varies: "void*", "void *", "void  *".
        if (StringUtils.deleteWhitespace(collapsed).equals("void*")) {
            return POINTER.keyword;
        }
        return collapsed;
    }

    private static HashMap<String, CType> initializeMap() {
        final HashMap<String, CType> result = new HashMap<>();
        for (final CType value : values()) {
            result.put(value.keyword, value);
        }
        return result;
    }
}
