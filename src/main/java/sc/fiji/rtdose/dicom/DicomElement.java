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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A single data element. Plain elements hold their little-endian value bytes. Sequences hold their items.
 * Encapsulated pixel data keeps its fragment items undecoded in {@link #getValue()}.
 */
public class DicomElement {
    private final int tag;
    private final VR vr;
    private final byte[] value;
    private final List<DicomDataset> items;
    private final boolean encapsulated;

    private DicomElement(int tag, VR vr, byte[] value, List<DicomDataset> items, boolean encapsulated) {
        this.tag = tag;
        this.vr = vr;
        this.value = value;
        this.items = items;
        this.encapsulated = encapsulated;
    }

    public static DicomElement of(int tag, VR vr, byte[] value) {
        if (vr == VR.SQ) throw new IllegalArgumentException("Sequences must be created with DicomElement.sequence");
        return new DicomElement(tag, vr, value, null, false);
    }

    public static DicomElement sequence(int tag, List<DicomDataset> items) {
        return new DicomElement(tag, VR.SQ, null, new ArrayList<>(items), false);
    }

    /**
     * @param fragments The raw items of the encapsulated value, up to but excluding the sequence delimiter.
     */
    public static DicomElement encapsulated(int tag, VR vr, byte[] fragments) {
        return new DicomElement(tag, vr, fragments, null, true);
    }

    public int getTag() {
        return tag;
    }

    public VR getVR() {
        return vr;
    }

    /**
     * @return  The value bytes, or null for a sequence. The array is shared.
     */
    public byte[] getValue() {
        return value;
    }

    /**
     * @return  The items of a sequence, or an empty list for other elements.
     */
    public List<DicomDataset> getItems() {
        return items == null ? Collections.emptyList() : Collections.unmodifiableList(items);
    }

    public boolean isSequence() {
        return vr == VR.SQ;
    }

    public boolean isEncapsulated() {
        return encapsulated;
    }

    public boolean isEmpty() {
        return isSequence() ? items.isEmpty() : value.length == 0;
    }

    /**
     * @return  A copy that shares nothing mutable with this element.
     */
    public DicomElement copy() {
        if (isSequence()) {
            List<DicomDataset> copies = new ArrayList<>(items.size());
            for (DicomDataset item : items)
                copies.add(item.copy());
            return new DicomElement(tag, vr, null, copies, false);
        }
        return new DicomElement(tag, vr, value.clone(), null, encapsulated);
    }

    public String toString() {
        String x = DicomTags.toString(tag) + " " + vr;
        if (isSequence()) return x + " items=" + items.size();
        return x + (encapsulated ? " encapsulated" : "") + " length=" + value.length;
    }
}
