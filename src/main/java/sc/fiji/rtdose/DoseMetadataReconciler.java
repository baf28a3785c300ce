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
package sc.fiji.rtdose;

import sc.fiji.rtdose.dicom.DicomDataset;
import sc.fiji.rtdose.dicom.DicomTags;
import sc.fiji.rtdose.dicom.VR;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Assembles the converted RT Dose dataset from a copy of the reference object.
 *
 * Spatial attributes come from the reference grid and its Frame of Reference UID, so the output overlays the
 * reference volume. The dose unit comes from the source field. Identity UIDs are the freshly generated ones.
 * The DVH Sequence is dropped because it describes the reference's pixels, not the new ones.
 */
public class DoseMetadataReconciler {
    public static final String RT_DOSE_STORAGE = "1.2.840.10008.5.1.4.1.1.481.2";
    public static final String DEFAULT_DOSE_TYPE = "PHYSICAL";
    public static final String DEFAULT_DOSE_SUMMATION_TYPE = "PLAN";
    public static final String SERIES_DESCRIPTION = "Eyeplan dose";

    private static final DateTimeFormatter DA_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter TM_FORMAT = DateTimeFormatter.ofPattern("HHmmss");

    private DoseMetadataReconciler() {
    }

    /**
     * @param reference     The reference RT Dose dataset. It is not modified.
     * @param grid          The reference voxel grid the dose was resampled onto.
     * @param encoded       The quantized doses.
     * @param identity      The new UIDs.
     * @param patientName   The patient name to record, or null to keep the reference's.
     * @param patientId     The patient ID to record, or null to keep the reference's.
     * @return              A write-ready dataset.
     * @throws MissingGeometryException When the reference has no Frame of Reference UID, or its shape differs
     *                                  from the encoded volume.
     */
    public static DicomDataset assemble(DicomDataset reference, VoxelGrid grid, EncodedDoseVolume encoded,
                                        OutputIdentity identity, String patientName, String patientId)
            throws MissingGeometryException {
        String frameOfReference = reference.getString(DicomTags.FRAME_OF_REFERENCE_UID);
        if (frameOfReference == null)
            throw new MissingGeometryException("The reference dose has no Frame of Reference UID to anchor the output to.");
        int[] size = grid.getSize();
        if (encoded.sizeX() != size[0] || encoded.sizeY() != size[1] || encoded.sizeZ() != size[2])
            throw new MissingGeometryException("The encoded dose is " + encoded.sizeX() + "x" + encoded.sizeY() + "x"
                    + encoded.sizeZ() + " but the reference grid is " + size[0] + "x" + size[1] + "x" + size[2] + ".");

        DicomDataset out = reference.copy();
        out.remove(DicomTags.PIXEL_DATA);
        out.remove(DicomTags.DVH_SEQUENCE);
        out.remove(DicomTags.SMALLEST_IMAGE_PIXEL_VALUE);
        out.remove(DicomTags.LARGEST_IMAGE_PIXEL_VALUE);

        // Identification.
        if (patientName != null || patientId != null) {
            String name = patientName == null ? "" : patientName;
            String id = patientId == null ? "" : patientId;
            if (!isAscii(name) || !isAscii(id))
                out.useUtf8();
            if (patientName != null) out.putString(DicomTags.PATIENT_NAME, VR.PN, patientName);
            if (patientId != null) out.putString(DicomTags.PATIENT_ID, VR.LO, patientId);
        }
        out.putString(DicomTags.SOP_CLASS_UID, VR.UI, RT_DOSE_STORAGE);
        out.putString(DicomTags.SOP_INSTANCE_UID, VR.UI, identity.getSopInstanceUid());
        out.putString(DicomTags.STUDY_INSTANCE_UID, VR.UI, identity.getStudyInstanceUid());
        out.putString(DicomTags.SERIES_INSTANCE_UID, VR.UI, identity.getSeriesInstanceUid());
        out.putString(DicomTags.FRAME_OF_REFERENCE_UID, VR.UI, frameOfReference);
        out.putString(DicomTags.MODALITY, VR.CS, "RTDOSE");
        out.putString(DicomTags.SERIES_DESCRIPTION, VR.LO, SERIES_DESCRIPTION);
        LocalDateTime now = LocalDateTime.now();
        out.putString(DicomTags.INSTANCE_CREATION_DATE, VR.DA, DA_FORMAT.format(now));
        out.putString(DicomTags.INSTANCE_CREATION_TIME, VR.TM, TM_FORMAT.format(now));

        // Geometry.
        out.putDecimals(DicomTags.IMAGE_POSITION_PATIENT, grid.getOrigin());
        double[] row = grid.getDirection(0), column = grid.getDirection(1);
        out.putDecimals(DicomTags.IMAGE_ORIENTATION_PATIENT, row[0], row[1], row[2], column[0], column[1], column[2]);
        double[] spacing = grid.getSpacing();
        out.putDecimals(DicomTags.PIXEL_SPACING, spacing[1], spacing[0]);
        out.putDecimals(DicomTags.GRID_FRAME_OFFSET_VECTOR, grid.frameOffsets());
        out.putTag(DicomTags.FRAME_INCREMENT_POINTER, DicomTags.GRID_FRAME_OFFSET_VECTOR);

        // Pixels.
        int bits = encoded.getPixelWidth().bits;
        out.putInts(DicomTags.SAMPLES_PER_PIXEL, VR.US, 1);
        out.putString(DicomTags.PHOTOMETRIC_INTERPRETATION, VR.CS, "MONOCHROME2");
        out.putInts(DicomTags.NUMBER_OF_FRAMES, VR.IS, size[2]);
        out.putInts(DicomTags.ROWS, VR.US, size[1]);
        out.putInts(DicomTags.COLUMNS, VR.US, size[0]);
        out.putInts(DicomTags.BITS_ALLOCATED, VR.US, bits);
        out.putInts(DicomTags.BITS_STORED, VR.US, bits);
        out.putInts(DicomTags.HIGH_BIT, VR.US, bits - 1);
        out.putInts(DicomTags.PIXEL_REPRESENTATION, VR.US, 0);
        out.putBytes(DicomTags.PIXEL_DATA, VR.OW, encoded.toPixelData());

        // Dose.
        out.putString(DicomTags.DOSE_UNITS, VR.CS, encoded.getDoseUnits());
        String doseType = reference.getString(DicomTags.DOSE_TYPE);
        out.putString(DicomTags.DOSE_TYPE, VR.CS, doseType == null ? DEFAULT_DOSE_TYPE : doseType);
        String summation = reference.getString(DicomTags.DOSE_SUMMATION_TYPE);
        out.putString(DicomTags.DOSE_SUMMATION_TYPE, VR.CS, summation == null ? DEFAULT_DOSE_SUMMATION_TYPE : summation);
        out.putDecimals(DicomTags.DOSE_GRID_SCALING, encoded.getScaleFactor());
        return out;
    }

    private static boolean isAscii(String s) {
        for (int i = 0; i < s.length(); i++)
            if (s.charAt(i) > 0x7F) return false;
        return true;
    }
}
