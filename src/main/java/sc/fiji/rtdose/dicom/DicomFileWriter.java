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

import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a {@link DicomDataset} as a DICOM Part 10 file in explicit VR little endian, with a fresh
 * file meta group derived from the dataset's SOP Class and SOP Instance UIDs.
 * Sequences and items are written with undefined lengths.
 * @author Andre Faubert 2024-04
 */
public class DicomFileWriter {
    public static final String IMPLEMENTATION_CLASS_UID = "2.25.153829201723095462437139548307582112851";
    public static final String IMPLEMENTATION_VERSION_NAME = "FIJI_RTDOSE_1";

    private static final int UNDEFINED_LENGTH = 0xFFFFFFFF;

    private DicomFileWriter() {
    }

    public static void write(DicomDataset dataset, Path path) throws IOException, DicomException {
        if (IJ.debugMode) IJ.log("Writing DICOM file: " + path);
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(path))) {
            write(dataset, out);
        }
    }

    /**
     * @param out   The stream to write to. It is not closed.
     * @throws DicomException   When the dataset lacks its SOP UIDs, or a value is too long for its VR.
     */
    public static void write(DicomDataset dataset, OutputStream out) throws IOException, DicomException {
        String sopClass = dataset.getString(DicomTags.SOP_CLASS_UID);
        String sopInstance = dataset.getString(DicomTags.SOP_INSTANCE_UID);
        if (sopClass == null || sopInstance == null)
            throw new DicomException("A dataset needs a SOP Class UID and a SOP Instance UID to be written to a file.");

        DicomDataset meta = new DicomDataset();
        meta.putBytes(DicomTags.FILE_META_INFORMATION_VERSION, VR.OB, new byte[] {0, 1});
        meta.putString(DicomTags.MEDIA_STORAGE_SOP_CLASS_UID, VR.UI, sopClass);
        meta.putString(DicomTags.MEDIA_STORAGE_SOP_INSTANCE_UID, VR.UI, sopInstance);
        meta.putString(DicomTags.TRANSFER_SYNTAX_UID, VR.UI, DicomFileReader.EXPLICIT_VR_LITTLE_ENDIAN);
        meta.putString(DicomTags.IMPLEMENTATION_CLASS_UID, VR.UI, IMPLEMENTATION_CLASS_UID);
        meta.putString(DicomTags.IMPLEMENTATION_VERSION_NAME, VR.SH, IMPLEMENTATION_VERSION_NAME);
        ByteArrayOutputStream metaBytes = new ByteArrayOutputStream();
        writeDataset(meta, metaBytes);

        out.write(new byte[128]);
        out.write("DICM".getBytes(StandardCharsets.US_ASCII));
        DicomDataset groupLength = new DicomDataset();
        groupLength.putInts(DicomTags.FILE_META_INFORMATION_GROUP_LENGTH, VR.UL, metaBytes.size());
        writeDataset(groupLength, out);
        metaBytes.writeTo(out);

        for (DicomElement element : dataset.elements()) {
            // A stale meta group, if any, was replaced above.
            if (DicomTags.group(element.getTag()) == 0x0002) continue;
            writeElement(element, out);
        }
    }

    private static void writeDataset(DicomDataset dataset, OutputStream out) throws IOException, DicomException {
        for (DicomElement element : dataset.elements())
            writeElement(element, out);
    }

    private static void writeElement(DicomElement element, OutputStream out) throws IOException, DicomException {
        int tag = element.getTag();
        VR vr = element.getVR();
        writeTag(out, tag);
        out.write(vr.name().charAt(0));
        out.write(vr.name().charAt(1));

        if (element.isSequence()) {
            writeShort(out, 0);
            writeInt(out, UNDEFINED_LENGTH);
            for (DicomDataset item : element.getItems()) {
                writeTag(out, DicomTags.ITEM);
                writeInt(out, UNDEFINED_LENGTH);
                writeDataset(item, out);
                writeTag(out, DicomTags.ITEM_DELIMITATION_ITEM);
                writeInt(out, 0);
            }
            writeTag(out, DicomTags.SEQUENCE_DELIMITATION_ITEM);
            writeInt(out, 0);
            return;
        }

        byte[] value = element.getValue();
        if (element.isEncapsulated()) {
            writeShort(out, 0);
            writeInt(out, UNDEFINED_LENGTH);
            out.write(value);
            writeTag(out, DicomTags.SEQUENCE_DELIMITATION_ITEM);
            writeInt(out, 0);
            return;
        }

        int length = value.length + (value.length % 2);
        if (vr.longLength) {
            writeShort(out, 0);
            writeInt(out, length);
        } else {
            if (length > 0xFFFF)
                throw new DicomException("The value of " + DicomTags.toString(tag) + " is too long for VR " + vr
                        + ": " + length + " bytes.");
            writeShort(out, length);
        }
        out.write(value);
        if (value.length % 2 != 0) out.write(vr.padding);
    }

    private static void writeTag(OutputStream out, int tag) throws IOException {
        writeShort(out, tag >>> 16);
        writeShort(out, tag & 0xFFFF);
    }

    private static void writeShort(OutputStream out, int v) throws IOException {
        out.write(v & 0xFF);
        out.write((v >>> 8) & 0xFF);
    }

    private static void writeInt(OutputStream out, int v) throws IOException {
        writeShort(out, v & 0xFFFF);
        writeShort(out, v >>> 16);
    }
}
