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

import ij.IJ;

import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a DICOM file encoded in implicit or explicit VR little endian into a {@link DicomDataset}.
 * Files without the 128-byte preamble and "DICM" prefix are accepted too, as long as they start
 * directly with the file meta group or with the dataset.
 * The file meta group is consumed to select the transfer syntax and is not part of the returned dataset.
 * @author Andre Faubert 2024-04
 */
public class DicomFileReader {
    public static final String IMPLICIT_VR_LITTLE_ENDIAN = "1.2.840.10008.1.2";
    public static final String EXPLICIT_VR_LITTLE_ENDIAN = "1.2.840.10008.1.2.1";

    private static final int PREAMBLE_LENGTH = 128;
    private static final int UNDEFINED_LENGTH = -1;

    private final ByteBuffer buf;
    private String transferSyntax;

    private DicomFileReader(byte[] bytes) {
        buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    }

    public static DicomDataset read(Path path) throws IOException, DicomException {
        if (IJ.debugMode) IJ.log("Reading DICOM file: " + path);
        return read(Files.readAllBytes(path));
    }

    public static DicomDataset read(byte[] bytes) throws DicomException {
        DicomFileReader reader = new DicomFileReader(bytes);
        try {
            return reader.readFile();
        } catch (BufferUnderflowException | IndexOutOfBoundsException e) {
            throw new DicomException("Unexpected end of file", reader.buf.position());
        }
    }

    /**
     * @return  The transfer syntax UID used to decode the last dataset.
     */
    String getTransferSyntax() {
        return transferSyntax;
    }

    private DicomDataset readFile() throws DicomException {
        if (hasPreamble()) buf.position(PREAMBLE_LENGTH + 4);

        if (buf.remaining() >= 2 && Short.toUnsignedInt(buf.getShort(buf.position())) == 0x0002) {
            DicomDataset meta = readMetaGroup();
            transferSyntax = meta.getString(DicomTags.TRANSFER_SYNTAX_UID);
            if (transferSyntax == null)
                throw new DicomException("The file meta information has no transfer syntax.");
        } else {
            transferSyntax = looksExplicit() ? EXPLICIT_VR_LITTLE_ENDIAN : IMPLICIT_VR_LITTLE_ENDIAN;
            if (IJ.debugMode) IJ.log("No file meta information, assuming " + transferSyntax);
        }

        boolean explicit;
        if (EXPLICIT_VR_LITTLE_ENDIAN.equals(transferSyntax)) explicit = true;
        else if (IMPLICIT_VR_LITTLE_ENDIAN.equals(transferSyntax)) explicit = false;
        else throw new DicomException("Unsupported transfer syntax " + transferSyntax
                    + ". Only implicit and explicit VR little endian can be read.");
        return readDataset(explicit, buf.limit());
    }

    private boolean hasPreamble() {
        if (buf.limit() < PREAMBLE_LENGTH + 4) return false;
        return buf.get(PREAMBLE_LENGTH) == 'D' && buf.get(PREAMBLE_LENGTH + 1) == 'I'
                && buf.get(PREAMBLE_LENGTH + 2) == 'C' && buf.get(PREAMBLE_LENGTH + 3) == 'M';
    }

    // An explicit VR dataset has two upper-case letters naming a VR right after the first tag.
    private boolean looksExplicit() {
        int p = buf.position();
        if (buf.limit() - p < 6) return false;
        return VR.of(buf.get(p + 4), buf.get(p + 5)) != null;
    }

    private DicomDataset readMetaGroup() throws DicomException {
        DicomDataset meta = new DicomDataset();
        while (buf.remaining() >= 4 && Short.toUnsignedInt(buf.getShort(buf.position())) == 0x0002)
            meta.put(readElement(true));
        return meta;
    }

    /**
     * Read elements until `end`, or until an item delimiter when `end` is {@link #UNDEFINED_LENGTH}.
     */
    private DicomDataset readDataset(boolean explicit, int end) throws DicomException {
        DicomDataset dataset = new DicomDataset();
        while (end == UNDEFINED_LENGTH ? buf.hasRemaining() : buf.position() < end) {
            int tag = peekTag();
            if (tag == DicomTags.ITEM_DELIMITATION_ITEM) {
                buf.position(buf.position() + 8);
                return dataset;
            }
            dataset.put(readElement(explicit));
        }
        if (end == UNDEFINED_LENGTH)
            throw new DicomException("Missing item delimiter", buf.position());
        if (buf.position() != end)
            throw new DicomException("An element overruns its enclosing item", buf.position());
        return dataset;
    }

    private int peekTag() {
        int p = buf.position();
        return (Short.toUnsignedInt(buf.getShort(p)) << 16) | Short.toUnsignedInt(buf.getShort(p + 2));
    }

    private int readTag() {
        int group = Short.toUnsignedInt(buf.getShort());
        int element = Short.toUnsignedInt(buf.getShort());
        return (group << 16) | element;
    }

    private DicomElement readElement(boolean explicit) throws DicomException {
        int start = buf.position();
        int tag = readTag();
        VR vr;
        int length;
        if (explicit) {
            byte first = buf.get();
            byte second = buf.get();
            vr = VR.of(first, second);
            if (vr == null)
                throw new DicomException("Unknown VR '" + (char) first + (char) second + "' in element "
                        + DicomTags.toString(tag), start);
            if (vr.longLength) {
                buf.getShort();  // Reserved.
                length = buf.getInt();
            } else {
                length = Short.toUnsignedInt(buf.getShort());
            }
        } else {
            length = buf.getInt();
            vr = DicomTags.vrOf(tag);
            if (vr == null) vr = length == UNDEFINED_LENGTH ? VR.SQ : VR.UN;
        }

        if (vr == VR.SQ || (vr == VR.UN && length == UNDEFINED_LENGTH)) {
            // An undefined length UN is a sequence encoded in implicit VR.
            boolean itemsExplicit = explicit && vr == VR.SQ;
            return DicomElement.sequence(tag, readItems(itemsExplicit, length));
        }
        if (length == UNDEFINED_LENGTH) {
            if (tag != DicomTags.PIXEL_DATA)
                throw new DicomException("Undefined length in non-sequence element " + DicomTags.toString(tag), start);
            return DicomElement.encapsulated(tag, vr, readFragments());
        }
        if (length < 0 || length > buf.remaining())
            throw new DicomException("Element " + DicomTags.toString(tag) + " has length " + Integer.toUnsignedString(length)
                    + " but only " + buf.remaining() + " bytes remain", start);
        byte[] value = new byte[length];
        buf.get(value);
        return DicomElement.of(tag, vr, value);
    }

    private List<DicomDataset> readItems(boolean explicit, int length) throws DicomException {
        List<DicomDataset> items = new ArrayList<>();
        int end = length == UNDEFINED_LENGTH ? UNDEFINED_LENGTH : buf.position() + length;
        while (end == UNDEFINED_LENGTH || buf.position() < end) {
            int start = buf.position();
            int tag = readTag();
            int itemLength = buf.getInt();
            if (tag == DicomTags.SEQUENCE_DELIMITATION_ITEM) {
                if (end != UNDEFINED_LENGTH)
                    throw new DicomException("Sequence delimiter in a sequence of defined length", start);
                return items;
            }
            if (tag != DicomTags.ITEM)
                throw new DicomException("Expected an item in a sequence, found " + DicomTags.toString(tag), start);
            int itemEnd = itemLength == UNDEFINED_LENGTH ? UNDEFINED_LENGTH : buf.position() + itemLength;
            items.add(readDataset(explicit, itemEnd));
        }
        return items;
    }

    /**
     * @return  The raw bytes of the fragment items of encapsulated pixel data, excluding the sequence delimiter.
     */
    private byte[] readFragments() throws DicomException {
        int start = buf.position();
        while (true) {
            int itemStart = buf.position();
            int tag = readTag();
            int length = buf.getInt();
            if (tag == DicomTags.SEQUENCE_DELIMITATION_ITEM) {
                byte[] fragments = new byte[itemStart - start];
                buf.get(start, fragments);
                return fragments;
            }
            if (tag != DicomTags.ITEM || length < 0 || length > buf.remaining())
                throw new DicomException("Malformed encapsulated pixel data", itemStart);
            buf.position(buf.position() + length);
        }
    }
}
