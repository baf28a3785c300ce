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

import ij.IJ;
import ij.Prefs;
import ij.gui.GenericDialog;
import ij.io.SaveDialog;
import ij.plugin.PlugIn;
import sc.fiji.rtdose.dicom.DicomException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * ImageJ plugin converting an Eyeplan dose export into a DICOM RT Dose file on the grid of a
 * reference RT Dose file, typically one exported by the treatment planning system for the same patient.
 * @author Andre Faubert 2024-04
 */
public class EyeplanToDicom implements PlugIn {
    private static final String KEY_WORKBOOK = ConversionOptions.PREFS_PREFIX + "workbook";
    private static final String KEY_REFERENCE = ConversionOptions.PREFS_PREFIX + "reference";
    private static final String KEY_SHOW = ConversionOptions.PREFS_PREFIX + "showResampled";

    private static final String[] EXTRAPOLATIONS = {"Clamp to the dose grid edge", "Fail"};
    private static final String[] BITS = {"32", "16"};

    /**
     * The main plugin entry point.
     * @param arg   The workbook path, or empty to ask for it.
     * @see         IJ#runPlugIn(String className, String arg)
     */
    public void run(String arg) {
        ConversionOptions options = ConversionOptions.fromPrefs();
        String workbook = arg == null || arg.isEmpty() ? Prefs.get(KEY_WORKBOOK, "") : arg;
        String reference = Prefs.get(KEY_REFERENCE, "");
        boolean showResampled = Prefs.get(KEY_SHOW, false);

        GenericDialog gd = new GenericDialog("Eyeplan Dose to DICOM RT");
        gd.addFileField("Eyeplan workbook", workbook, 40);
        gd.addFileField("Reference RT Dose", reference, 40);
        gd.addChoice("Axis mapping (X, Y, Z columns)", AxisMapping.labels(), options.getAxisMapping().getLabel());
        gd.addChoice("Dose units", ConversionOptions.DOSE_UNITS, options.getDoseUnits());
        int extrapolationIndex = options.getResampling().getExtrapolation() == ResamplingOptions.Extrapolation.CLAMP ? 0 : 1;
        gd.addChoice("Outside the Eyeplan grid", EXTRAPOLATIONS, EXTRAPOLATIONS[extrapolationIndex]);
        gd.addNumericField("Coordinate tolerance", options.getResampling().getToleranceEpsilon(), 6, 10, "mm");
        gd.addChoice("Bits per pixel", BITS, String.valueOf(options.getEncoding().getPixelWidth().bits));
        gd.addNumericField("Zero doses below", options.getEncoding().getZeroThreshold(), 12, 14, options.getDoseUnits());
        gd.addCheckbox("Show the resampled dose", showResampled);
        gd.setOKLabel("Select output");
        gd.showDialog();
        if (gd.wasCanceled()) return;

        workbook = gd.getNextString().trim();
        reference = gd.getNextString().trim();
        AxisMapping mapping = AxisMapping.fromLabel(gd.getNextChoice());
        String units = gd.getNextChoice();
        ResamplingOptions.Extrapolation extrapolation = gd.getNextChoiceIndex() == 0
                ? ResamplingOptions.Extrapolation.CLAMP : ResamplingOptions.Extrapolation.ERROR;
        double tolerance = gd.getNextNumber();
        PixelWidth width = PixelWidth.fromBits(Integer.parseInt(gd.getNextChoice()));
        double zeroThreshold = gd.getNextNumber();
        showResampled = gd.getNextBoolean();

        if (gd.invalidNumber() || !(tolerance >= 0) || !(zeroThreshold >= 0)) {
            IJ.error(DoseConversionException.TITLE, "The tolerance and the zero threshold must be non-negative numbers.");
            return;
        }
        if (!Files.isRegularFile(Paths.get(workbook))) {
            IJ.error(DoseConversionException.TITLE, "The Eyeplan workbook was not found: " + workbook);
            return;
        }
        if (!Files.isRegularFile(Paths.get(reference))) {
            IJ.error(DoseConversionException.TITLE, "The reference RT Dose file was not found: " + reference);
            return;
        }

        options = new ConversionOptions(
                new ResamplingOptions(extrapolation, tolerance, options.getResampling().getThreads()),
                new EncodingOptions(width, zeroThreshold, options.getEncoding().getPrecisionFloor()),
                mapping, units);
        options.saveToPrefs();
        Prefs.set(KEY_WORKBOOK, workbook);
        Prefs.set(KEY_REFERENCE, reference);
        Prefs.set(KEY_SHOW, showResampled);
        if (IJ.debugMode) IJ.log("Conversion options: " + options);

        String defaultName = Paths.get(workbook).getFileName().toString().replaceFirst("\\.[^.]*$", "");
        SaveDialog sd = new SaveDialog("Save RT Dose As...", "RD." + defaultName, ".dcm");
        if (sd.getFileName() == null) return;
        Path output = Paths.get(sd.getDirectory(), sd.getFileName());

        try {
            ConversionResult result = new EyeplanConversion(options).run(Paths.get(workbook), Paths.get(reference), output);
            if (showResampled)
                DoseImages.toImagePlus(output.getFileName().toString(), result.getResampled(), result.getGrid()).show();
        } catch (IOException e) {
            new DoseConversionException("An error occurred when reading or writing a file: " + e, e).report();
        } catch (DicomException e) {
            e.report();
        } catch (DoseConversionException e) {
            e.report();
        } finally {
            IJ.showProgress(1.0);
        }
    }
}
