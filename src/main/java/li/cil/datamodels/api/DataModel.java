package li.cil.datamodels.api;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import static li.cil.datamodels.api.Sizes.*;

/**
 * A data model is a platform's choice of widths for the C integer types.
 * <p>
 * The C standard defines five integer types, {@code char}, {@code short}, {@code int}, {@code long}
 * and {@code long long}, but does not fix their exact number of bits. A platform or vendor dependent
 * data model does.
 * <p>
 * Model names signify each type by a letter followed by its size; for example, ILP32 means
 * (I)nt, (L)ong and (P)ointer are 32 bits. The naming scheme is not entirely consistent.
 * <p>
 * Four data models found wide acceptance:
 * <ul>
 *     <li>{@link #LP32} or 2/4/4 (m68k Mac, Win16 API)</li>
 *     <li>{@link #ILP32} or 4/4/4 (Win32 API, Unix and Unix-like systems)</li>
 *     <li>{@link #LLP64} or 4/4/8 (Win64 API)</li>
 *     <li>{@link #LP64} or 4/8/8 (Unix and Unix-like systems)</li>
 * </ul>
 * Sizes are reported in bytes. A size of {@link Sizes#UNDEFINED} means the type does not exist in
 * the model, or its size is not specified.
 * <p>
 * References:
 * <ol>
 *     <li>J. R. Mashey. The long road to 64 bits. ACM Queue Magazine, 4(8):24-35, 2006.</li>
 *     <li>T. Lauer. Porting to Win32: A Guide to Making Your Applications Ready for the 32-Bit Future of Windows. Springer, 1996.</li>
 * </ol>
 */
public enum DataModel {
    //      char          short          int            long           long long      pointer
    IP16(SIZE_8_BYTES, UNDEFINED, SIZE_16_BYTES, UNDEFINED, UNDEFINED, SIZE_16_BYTES,
            "16-bit int and pointer (16-bit PDP-11)"),
    IP16L32(SIZE_8_BYTES, SIZE_16_BYTES, SIZE_16_BYTES, SIZE_32_BYTES, UNDEFINED, SIZE_16_BYTES,
            "16-bit int and pointer, 32-bit long (32-bit PDP-11)"),
    LP32(SIZE_8_BYTES, SIZE_16_BYTES, SIZE_16_BYTES, SIZE_32_BYTES, SIZE_64_BYTES, SIZE_32_BYTES,
            "16-bit int, 32-bit long and pointer (m68k Mac, Win16)"),
    ILP32(SIZE_8_BYTES, SIZE_16_BYTES, SIZE_32_BYTES, SIZE_32_BYTES, SIZE_64_BYTES, SIZE_32_BYTES,
            "32-bit int, long and pointer (Unix before the mid-1990s, Win32)"),
    LLP64(SIZE_8_BYTES, SIZE_16_BYTES, SIZE_32_BYTES, SIZE_32_BYTES, SIZE_64_BYTES, SIZE_64_BYTES,
            "32-bit int and long, 64-bit pointer (Windows since XP)"),
    LP64(SIZE_8_BYTES, SIZE_16_BYTES, SIZE_32_BYTES, SIZE_64_BYTES, SIZE_64_BYTES, SIZE_64_BYTES,
            "32-bit int, 64-bit long and pointer (Unix and Linux after the 1990s)"),
    ILP64(SIZE_8_BYTES, SIZE_16_BYTES, SIZE_64_BYTES, SIZE_64_BYTES, SIZE_64_BYTES, SIZE_64_BYTES,
            "64-bit int, long and pointer (HAL/Fujitsu SPARC64)"),
    SILP64(SIZE_8_BYTES, SIZE_64_BYTES, SIZE_64_BYTES, SIZE_64_BYTES, SIZE_64_BYTES, SIZE_64_BYTES,
            "64-bit short, int, long and pointer (Cray UNICOS)"),
    /**
     * Sentinel for a model that could not be determined. All sizes are {@link Sizes#UNDEFINED}.
     */
    UNKNOWN(UNDEFINED, UNDEFINED, UNDEFINED, UNDEFINED, UNDEFINED, UNDEFINED,
            "unknown data model"),
    ;

    private static final Logger LOGGER = LogManager.getLogger();

    private static final HashMap<String, DataModel> BY_NAME = initializeMap();

    private final int charSize;
    private final int shortSize;
    private final int intSize;
    private final int longSize;
    private final int longLongSize;
    private final int pointerSize;
    private final String description;

    DataModel(final int charSize, final int shortSize, final int intSize, final int longSize,
              final int longLongSize, final int pointerSize, final String description) {
        this.charSize = charSize;
        this.shortSize = shortSize;
        this.intSize = intSize;
        this.longSize = longSize;
        this.longLongSize = longLongSize;
        this.pointerSize = pointerSize;
        this.description = description;
    }

    /**
     * Guesses the data model from the sizes of {@code int}, {@code long} and pointers.
     * <p>
     * Only an exact match of all three sizes yields a model. {@link #SILP64} is never returned,
     * because it only differs from {@link #ILP64} in the size of {@code short}; {@code (8, 8, 8)}
     * always yields {@link #ILP64}.
     *
     * @param intSize     the size of {@code int}, in bytes.
     * @param longSize    the size of {@code long}, in bytes.
     * @param pointerSize the size of a pointer, in bytes.
     * @return the matching data model, or {@link #UNKNOWN} if there is none.
     */
    @Nonnull
    public static DataModel of(final int intSize, final int longSize, final int pointerSize) {
        if (intSize == 2 && longSize == 0 && pointerSize == 2) return IP16;
        if (intSize == 2 && longSize == 4 && pointerSize == 2) return IP16L32;
        if (intSize == 2 && longSize == 4 && pointerSize == 4) return LP32;
        if (intSize == 4 && longSize == 4 && pointerSize == 4) return ILP32;
        if (intSize == 4 && longSize == 4 && pointerSize == 8) return LLP64;
        if (intSize == 4 && longSize == 8 && pointerSize == 8) return LP64;
        if (intSize == 8 && longSize == 8 && pointerSize == 8) return ILP64;

        LOGGER.debug("No data model for int/long/pointer sizes [{}/{}/{}].", intSize, longSize, pointerSize);
        return UNKNOWN;
    }

    /**
     * Looks up a data model by its name, ignoring case.
     *
     * @param name the name of the data model, e.g. {@code "LP64"}.
     * @return the data model, if the name denotes one.
     */
    @Nonnull
    public static Optional<DataModel> byName(@Nullable final String name) {
        if (name == null) {
            return Optional.empty();
        }

        final DataModel model = BY_NAME.get(name.trim().toUpperCase(Locale.ROOT));
        if (model == null) {
            LOGGER.debug("No data model named [{}].", name);
        }
        return Optional.ofNullable(model);
    }

    /**
     * The size of the specified type in this data model.
     *
     * @param type the type to get the size of.
     * @return the size in bytes, or {@link Sizes#UNDEFINED} if the type has no size in this model.
     */
    public int sizeOf(final CType type) {
        return switch (Objects.requireNonNull(type)) {
            case CHAR -> charSize;
            case SHORT -> shortSize;
            case INT -> intSize;
            case LONG -> longSize;
            case LONG_LONG -> longLongSize;
            case POINTER -> pointerSize;
        };
    }

    /**
     * The width of the specified type in this data model.
     *
     * @param type the type to get the width of.
     * @return the width in bits, or {@link Sizes#UNDEFINED} if the type has no size in this model.
     */
    public int bitsOf(final CType type) {
        return sizeOf(type) * CHAR_BIT;
    }

    public boolean isDefined(final CType type) {
        return sizeOf(type) != UNDEFINED;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    /**
     * A short note on the model's layout and the platforms using it.
     *
     * @return the description of this data model.
     */
    public String description() {
        return description;
    }

    private static HashMap<String, DataModel> initializeMap() {
        final HashMap<String, DataModel> result = new HashMap<>();
        for (final DataModel value : values()) {
            result.put(value.name(), value);
        }
        return result;
    }
}
