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

import java.util.HashMap;
import java.util.Map;

/**
 * The attribute tags read or written when converting RT Dose objects, and their value representations.
 * The VRs are needed to decode files written in implicit VR, which do not carry them.
 */
public final class DicomTags {
    // File meta information.
    public static final int FILE_META_INFORMATION_GROUP_LENGTH = 0x00020000;
    public static final int FILE_META_INFORMATION_VERSION = 0x00020001;
    public static final int MEDIA_STORAGE_SOP_CLASS_UID = 0x00020002;
    public static final int MEDIA_STORAGE_SOP_INSTANCE_UID = 0x00020003;
    public static final int TRANSFER_SYNTAX_UID = 0x00020010;
    public static final int IMPLEMENTATION_CLASS_UID = 0x00020012;
    public static final int IMPLEMENTATION_VERSION_NAME = 0x00020013;

    // Identification.
    public static final int SPECIFIC_CHARACTER_SET = 0x00080005;
    public static final int INSTANCE_CREATION_DATE = 0x00080012;
    public static final int INSTANCE_CREATION_TIME = 0x00080013;
    public static final int SOP_CLASS_UID = 0x00080016;
    public static final int SOP_INSTANCE_UID = 0x00080018;
    public static final int MODALITY = 0x00080060;
    public static final int SERIES_DESCRIPTION = 0x0008103E;
    public static final int REFERENCED_SOP_CLASS_UID = 0x00081150;
    public static final int REFERENCED_SOP_INSTANCE_UID = 0x00081155;
    public static final int PATIENT_NAME = 0x00100010;
    public static final int PATIENT_ID = 0x00100020;
    public static final int STUDY_INSTANCE_UID = 0x0020000D;
    public static final int SERIES_INSTANCE_UID = 0x0020000E;
    public static final int INSTANCE_NUMBER = 0x00200013;
    public static final int FRAME_OF_REFERENCE_UID = 0x00200052;

    // Geometry.
    public static final int SLICE_THICKNESS = 0x00180050;
    public static final int IMAGE_POSITION_PATIENT = 0x00200032;
    public static final int IMAGE_ORIENTATION_PATIENT = 0x00200037;
    public static final int PIXEL_SPACING = 0x00280030;
    public static final int GRID_FRAME_OFFSET_VECTOR = 0x3004000C;

    // Image pixel module.
    public static final int SAMPLES_PER_PIXEL = 0x00280002;
    public static final int PHOTOMETRIC_INTERPRETATION = 0x00280004;
    public static final int NUMBER_OF_FRAMES = 0x00280008;
    public static final int FRAME_INCREMENT_POINTER = 0x00280009;
    public static final int ROWS = 0x00280010;
    public static final int COLUMNS = 0x00280011;
    public static final int BITS_ALLOCATED = 0x00280100;
    public static final int BITS_STORED = 0x00280101;
    public static final int HIGH_BIT = 0x00280102;
    public static final int PIXEL_REPRESENTATION = 0x00280103;
    public static final int SMALLEST_IMAGE_PIXEL_VALUE = 0x00280106;
    public static final int LARGEST_IMAGE_PIXEL_VALUE = 0x00280107;
    public static final int PIXEL_DATA = 0x7FE00010;

    // RT Dose module.
    public static final int DOSE_UNITS = 0x30040002;
    public static final int DOSE_TYPE = 0x30040004;
    public static final int DOSE_COMMENT = 0x30040006;
    public static final int DOSE_SUMMATION_TYPE = 0x3004000A;
    public static final int DOSE_GRID_SCALING = 0x3004000E;
    public static final int DVH_SEQUENCE = 0x30040050;
    public static final int REFERENCED_RT_PLAN_SEQUENCE = 0x300C0002;

    // Sequence delimitation.
    public static final int ITEM = 0xFFFEE000;
    public static final int ITEM_DELIMITATION_ITEM = 0xFFFEE00D;
    public static final int SEQUENCE_DELIMITATION_ITEM = 0xFFFEE0DD;

    private static final Map<Integer, VR> DICTIONARY = new HashMap<>();

    static {
        DICTIONARY.put(FILE_META_INFORMATION_GROUP_LENGTH, VR.UL);
        DICTIONARY.put(FILE_META_INFORMATION_VERSION, VR.OB);
        DICTIONARY.put(MEDIA_STORAGE_SOP_CLASS_UID, VR.UI);
        DICTIONARY.put(MEDIA_STORAGE_SOP_INSTANCE_UID, VR.UI);
        DICTIONARY.put(TRANSFER_SYNTAX_UID, VR.UI);
        DICTIONARY.put(IMPLEMENTATION_CLASS_UID, VR.UI);
        DICTIONARY.put(IMPLEMENTATION_VERSION_NAME, VR.SH);
        DICTIONARY.put(SPECIFIC_CHARACTER_SET, VR.CS);
        DICTIONARY.put(INSTANCE_CREATION_DATE, VR.DA);
        DICTIONARY.put(INSTANCE_CREATION_TIME, VR.TM);
        DICTIONARY.put(SOP_CLASS_UID, VR.UI);
        DICTIONARY.put(SOP_INSTANCE_UID, VR.UI);
        DICTIONARY.put(MODALITY, VR.CS);
        DICTIONARY.put(SERIES_DESCRIPTION, VR.LO);
        DICTIONARY.put(REFERENCED_SOP_CLASS_UID, VR.UI);
        DICTIONARY.put(REFERENCED_SOP_INSTANCE_UID, VR.UI);
        DICTIONARY.put(PATIENT_NAME, VR.PN);
        DICTIONARY.put(PATIENT_ID, VR.LO);
        DICTIONARY.put(STUDY_INSTANCE_UID, VR.UI);
        DICTIONARY.put(SERIES_INSTANCE_UID, VR.UI);
        DICTIONARY.put(INSTANCE_NUMBER, VR.IS);
        DICTIONARY.put(FRAME_OF_REFERENCE_UID, VR.UI);
        DICTIONARY.put(SLICE_THICKNESS, VR.DS);
        DICTIONARY.put(IMAGE_POSITION_PATIENT, VR.DS);
        DICTIONARY.put(IMAGE_ORIENTATION_PATIENT, VR.DS);
        DICTIONARY.put(PIXEL_SPACING, VR.DS);
        DICTIONARY.put(GRID_FRAME_OFFSET_VECTOR, VR.DS);
        DICTIONARY.put(SAMPLES_PER_PIXEL, VR.US);
        DICTIONARY.put(PHOTOMETRIC_INTERPRETATION, VR.CS);
        DICTIONARY.put(NUMBER_OF_FRAMES, VR.IS);
        DICTIONARY.put(FRAME_INCREMENT_POINTER, VR.AT);
        DICTIONARY.put(ROWS, VR.US);
        DICTIONARY.put(COLUMNS, VR.US);
        DICTIONARY.put(BITS_ALLOCATED, VR.US);
        DICTIONARY.put(BITS_STORED, VR.US);
        DICTIONARY.put(HIGH_BIT, VR.US);
        DICTIONARY.put(PIXEL_REPRESENTATION, VR.US);
        DICTIONARY.put(SMALLEST_IMAGE_PIXEL_VALUE, VR.US);
        DICTIONARY.put(LARGEST_IMAGE_PIXEL_VALUE, VR.US);
        DICTIONARY.put(PIXEL_DATA, VR.OW);
        DICTIONARY.put(DOSE_UNITS, VR.CS);
        DICTIONARY.put(DOSE_TYPE, VR.CS);
        DICTIONARY.put(DOSE_COMMENT, VR.LO);
        DICTIONARY.put(DOSE_SUMMATION_TYPE, VR.CS);
        DICTIONARY.put(DOSE_GRID_SCALING, VR.DS);
        DICTIONARY.put(DVH_SEQUENCE, VR.SQ);
        DICTIONARY.put(REFERENCED_RT_PLAN_SEQUENCE, VR.SQ);
    }

    private DicomTags() {
    }

    /**
     * @return  The VR of a known attribute, UL for group lengths, or null when the tag is not known.
     */
    public static VR vrOf(int tag) {
        if ((tag & 0xFFFF) == 0) return VR.UL;
        return DICTIONARY.get(tag);
    }

    public static int group(int tag) {
        return tag >>> 16;
    }

    public static String toString(int tag) {
        return String.format("(%04X,%04X)", tag >>> 16, tag & 0xFFFF);
    }
}
