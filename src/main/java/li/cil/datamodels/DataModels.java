package li.cil.datamodels;

import li.cil.datamodels.api.CType;
import li.cil.datamodels.api.DataModel;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

public final class DataModels {
    private static final int NAME_WIDTH = 8;
    private static final int COLUMN_WIDTH = 10;

    private static final CType[] PROMOTION_ORDER = {
            CType.CHAR, CType.SHORT, CType.INT, CType.LONG, CType.LONG_LONG
    };

    /**
     * Collects all known data models using the specified sizes for {@code int}, {@code long} and pointers.
     * <p>
     * Unlike {@link DataModel#of(int, int, int)} this reports every match, so models that only
     * differ in other types, such as {@link DataModel#ILP64} and {@link DataModel#SILP64}, are all
     * returned. Models are listed in declaration order.
     *
     * @param intSize     the size of {@code int}, in bytes.
     * @param longSize    the size of {@code long}, in bytes.
     * @param pointerSize the size of a pointer, in bytes.
     * @return the matching data models, empty if there are none.
     */
    @Nonnull
    public static List<DataModel> candidates(final int intSize, final int longSize, final int pointerSize) {
        final List<DataModel> result = new ArrayList<>();
        for (final DataModel model : DataModel.values()) {
            if (model.isKnown() &&
                model.sizeOf(CType.INT) == intSize &&
                model.sizeOf(CType.LONG) == longSize &&
                model.sizeOf(CType.POINTER) == pointerSize) {
                result.add(model);
            }
        }
        return result;
    }

    /**
     * Checks that the defined integer sizes of a model never decrease along
     * {@code char <= short <= int <= long <= long long}.
     * <p>
     * Undefined sizes are skipped.
     *
     * @param model the data model to check.
     * @return {@code true} if the sizes are ordered; {@code false} otherwise.
     */
    public static boolean isPromotionOrdered(final DataModel model) {
        int previous = 0;
        for (final CType type : PROMOTION_ORDER) {
            if (!model.isDefined(type)) {
                continue;
            }
            final int size = model.sizeOf(type);
            if (size < previous) {
                return false;
            }
            previous = size;
        }
        return true;
    }

    /**
     * Checks that every type defined by a model is at least as wide as the C standard requires.
     *
     * @param model the data model to check.
     * @return {@code true} if all defined types meet their minimum width; {@code false} otherwise.
     */
    public static boolean meetsStandardMinimums(final DataModel model) {
        for (final CType type : CType.values()) {
            if (model.isDefined(type) && model.bitsOf(type) < type.minimumBits()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Renders the size table of all data models, in bytes, with one header line and one line per model.
     * Undefined sizes are shown as {@code -}.
     *
     * @return the formatted table.
     */
    @Nonnull
    public static String formatTable() {
        final StringBuilder sb = new StringBuilder();
        sb.append(StringUtils.rightPad("", NAME_WIDTH));
        for (final CType type : CType.values()) {
            sb.append(StringUtils.leftPad(type.keyword(), COLUMN_WIDTH));
        }
        sb.append('\n');

        for (final DataModel model : DataModel.values()) {
            sb.append(StringUtils.rightPad(model.name(), NAME_WIDTH));
            for (final CType type : CType.values()) {
                final String cell = model.isDefined(type) ? Integer.toString(model.sizeOf(type)) : "-";
                sb.append(StringUtils.leftPad(cell, COLUMN_WIDTH));
            }
            sb.append('\n');
        }

        return sb.toString();
    }

    private DataModels() {
    }
}
