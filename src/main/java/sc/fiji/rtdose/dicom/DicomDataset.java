/*-
 * #%L
 * Eyeplan RT Dose plugin for Fiji.
 * %%
 * Copyright (C) 2008 - 2024 Fiji developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */
package sc.fiji.rtdose.dicom;

import java.math.BigDecimal;
import java.math.MathContext;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;

/**
 * An ordered set of data elements, either a whole object or a sequence item.
 * Values are kept in their little-endian encoded form; the typed accessors decode and encode on demand.
 * @author Andre Faubert 2024-04
 */
public class DicomDataset {
    // DS values are limited to 16 characters.
    private static final int DS_MAX_LENGTH = 16;
    private static final String UTF_8_CHARSET = "ISO_IR 192";
    // The VRs whose values depend on Specific Character Set.
    private static final Set<VR> CHARACTER_SET_VRS = EnumSet.of(VR.SH, VR.LO, VR.ST, VR.LT, VR.PN, VR.UC, VR.UT);

    private final TreeMap<Integer, DicomElement> elements = new TreeMap<>(Integer::compareUnsigned);

    public DicomDataset copy() {
        DicomDataset copy = new DicomDataset();
        for (DicomElement element : elements.values())
            copy.put(element.copy());
        return copy;
    }

    public void put(DicomElement element) {
        elements.put(element.getTag(), element);
    }

    public DicomElement get(int tag) {
        return elements.get(tag);
    }

    public boolean contains(int tag) {
        return elements.containsKey(tag);
    }

    /**
     * @return  True when the attribute is present with a non-empty value.
     */
    public boolean hasValue(int tag) {
        DicomElement element = elements.get(tag);
        return element != null && !element.isEmpty();
    }

    public DicomElement remove(int tag) {
        return elements.remove(tag);
    }

    /**
     * @return  The elements in ascending tag order.
     */
    public Collection<DicomElement> elements() {
        return elements.values();
    }

    public int size() {
        return elements.size();
    }

    /**
     * @return  The character set of text values, following Specific Character Set.
     *          Only the default repertoire and UTF-8 are recognized.
     */
    public Charset charset() {
        String scs = getString(DicomTags.SPECIFIC_CHARACTER_SET, StandardCharsets.US_ASCII);
        if (scs != null && scs.contains(UTF_8_CHARSET)) return StandardCharsets.UTF_8;
        return StandardCharsets.ISO_8859_1;
    }

    /**
     * Switch Specific Character Set to UTF-8. Text values already present are re-encoded, including those
     * of sequence items that inherit the character set, so they keep reading the same.
     */
    public void useUtf8() {
        Charset from = charset();
        if (from.equals(StandardCharsets.UTF_8)) return;
        recode(from, StandardCharsets.UTF_8);
        putString(DicomTags.SPECIFIC_CHARACTER_SET, VR.CS, UTF_8_CHARSET);
    }

    private void recode(Charset from, Charset to) {
        for (DicomElement element : new ArrayList<>(elements.values())) {
            if (element.isSequence()) {
                for (DicomDataset item : element.getItems())
                    if (!item.contains(DicomTags.SPECIFIC_CHARACTER_SET)) item.recode(from, to);
            } else if (CHARACTER_SET_VRS.contains(element.getVR()) && element.getValue().length > 0) {
                String text = new String(element.getValue(), from);
                int end = text.length();
                while (end > 0 && text.charAt(end - 1) == ' ') end--;
                put(DicomElement.of(element.getTag(), element.getVR(), pad(text.substring(0, end).getBytes(to), element.getVR())));
            }
        }
    }

    // Accessors.

    /**
     * @return  The first value of a text attribute with padding removed, or null when absent or empty.
     */
    public String getString(int tag) {
        return getString(tag, charset());
    }

    private String getString(int tag, Charset charset) {
        String[] values = getStrings(tag, charset);
        return values == null || values.length == 0 || values[0].isEmpty() ? null : values[0];
    }

    /**
     * @return  All backslash-separated values of a text attribute, trimmed, or null when absent or empty.
     */
    public String[] getStrings(int tag) {
        return getStrings(tag, charset());
    }

    private String[] getStrings(int tag, Charset charset) {
        DicomElement element = elements.get(tag);
        if (element == null || element.isSequence() || element.getValue().length == 0) return null;
        String text = new String(element.getValue(), charset);
        // UI values are padded with NUL, other text with spaces.
        text = text.replace('\0', ' ');
        String[] values = text.split("\\\\", -1);
        for (int i = 0; i < values.length; i++)
            values[i] = values[i].trim();
        return values;
    }

    /**
     * Decode a numeric attribute, whether stored as decimal text (DS, IS) or binary (FD, FL, US, UL, SS, SL).
     * @return  The values, or null when the attribute is absent or empty.
     * @throws NumberFormatException    When a text value is not a number.
     */
    public double[] getDoubles(int tag) {
        DicomElement element = elements.get(tag);
        if (element == null || element.isSequence() || element.getValue().length == 0) return null;
        VR vr = element.getVR();
        if (vr == VR.DS || vr == VR.IS) {
            String[] values = getStrings(tag);
            double[] result = new double[values.length];
            for (int i = 0; i < values.length; i++)
                result[i] = Double.parseDouble(values[i]);
            return result;
        }
        ByteBuffer buf = ByteBuffer.wrap(element.getValue()).order(ByteOrder.LITTLE_ENDIAN);
        int width;
        switch (vr) {
            case FD: width = 8; break;
            case FL: case UL: case SL: width = 4; break;
            case US: case SS: width = 2; break;
            default: throw new NumberFormatException(DicomTags.toString(tag) + " has non-numeric VR " + vr);
        }
        double[] result = new double[buf.remaining() / width];
        for (int i = 0; i < result.length; i++) {
            switch (vr) {
                case FD: result[i] = buf.getDouble(); break;
                case FL: result[i] = buf.getFloat(); break;
                case UL: result[i] = Integer.toUnsignedLong(buf.getInt()); break;
                case SL: result[i] = buf.getInt(); break;
                case US: result[i] = Short.toUnsignedInt(buf.getShort()); break;
                default: result[i] = buf.getShort(); break;
            }
        }
        return result;
    }

    /**
     * @return  The first value of an integer attribute, or `defaultValue` when absent or empty.
     * @throws NumberFormatException    When the value is not an integer.
     */
    public int getInt(int tag, int defaultValue) {
        double[] values = getDoubles(tag);
        if (values == null || values.length == 0) return defaultValue;
        double v = values[0];
        if (v != Math.rint(v) || v > Integer.MAX_VALUE || v < Integer.MIN_VALUE)
            throw new NumberFormatException(DicomTags.toString(tag) + " is not an integer: " + v);
        return (int) v;
    }

    public List<DicomDataset> getSequence(int tag) {
        DicomElement element = elements.get(tag);
        if (element == null || !element.isSequence()) return null;
        return element.getItems();
    }

    // Mutators. Values are padded to an even length here so that the writer can copy them verbatim.

    public void putString(int tag, VR vr, String... values) {
        if (!vr.text) throw new IllegalArgumentException(vr + " is not a text VR");
        String joined = String.join("\\", values);
        put(DicomElement.of(tag, vr, pad(joined.getBytes(charset()), vr)));
    }

    /**
     * Store decimal strings, each shortened as needed to fit the 16 characters a DS value allows.
     */
    public void putDecimals(int tag, double... values) {
        String[] text = new String[values.length];
        for (int i = 0; i < values.length; i++)
            text[i] = formatDS(values[i]);
        putString(tag, VR.DS, text);
    }

    public void putInts(int tag, VR vr, int... values) {
        if (vr == VR.IS) {
            String[] text = new String[values.length];
            for (int i = 0; i < values.length; i++)
                text[i] = Integer.toString(values[i]);
            putString(tag, vr, text);
            return;
        }
        int width;
        switch (vr) {
            case US: case SS: width = 2; break;
            case UL: case SL: width = 4; break;
            default: throw new IllegalArgumentException(vr + " is not an integer VR");
        }
        ByteBuffer buf = ByteBuffer.allocate(values.length * width).order(ByteOrder.LITTLE_ENDIAN);
        for (int v : values) {
            if (width == 2) buf.putShort((short) v);
            else buf.putInt(v);
        }
        put(DicomElement.of(tag, vr, buf.array()));
    }

    /**
     * Store an attribute tag, as Frame Increment Pointer does.
     */
    public void putTag(int tag, int value) {
        ByteBuffer buf = ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN);
        buf.putShort((short) (value >>> 16));
        buf.putShort((short) value);
        put(DicomElement.of(tag, VR.AT, buf.array()));
    }

    public void putBytes(int tag, VR vr, byte[] value) {
        put(DicomElement.of(tag, vr, pad(value, vr)));
    }

    public void putSequence(int tag, List<DicomDataset> items) {
        put(DicomElement.sequence(tag, items));
    }

    private static byte[] pad(byte[] value, VR vr) {
        if (value.length % 2 == 0) return value;
        byte[] padded = new byte[value.length + 1];
        System.arraycopy(value, 0, padded, 0, value.length);
        padded[value.length] = vr.padding;
        return padded;
    }

    /**
     * Format a number as a DS value, keeping as many significant digits as fit in 16 characters.
     * @throws IllegalArgumentException When the value is not finite.
     */
    public static String formatDS(double value) {
        if (!Double.isFinite(value)) throw new IllegalArgumentException("DS values must be finite: " + value);
        if (value == Math.rint(value) && Math.abs(value) < 1e15) return Long.toString((long) value);
        String text = Double.toString(value);
        for (int digits = 15; text.length() > DS_MAX_LENGTH && digits > 0; digits--)
            text = new BigDecimal(value).round(new MathContext(digits)).stripTrailingZeros().toString();
        return text;
    }

    public String toString() {
        List<String> lines = new ArrayList<>();
        for (DicomElement element : elements.values())
            lines.add(element.toString());
        return "DicomDataset(" + String.join(", ", lines) + ")";
    }
}
