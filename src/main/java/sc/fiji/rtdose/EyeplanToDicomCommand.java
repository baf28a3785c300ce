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
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import sc.fiji.rtdose.dicom.DicomException;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command line entry point: {@code filename sourcedicom outputdicom [-d]}.
 * Exits with status 0 on success, 1 when the conversion fails and 2 on bad arguments.
 */
@Command(name = "eyeplan-to-dicom", mixinStandardHelpOptions = true, version = "Eyeplan RT Dose 1.0",
        description = "Converts an Eyeplan dose workbook into a DICOM RT Dose file on the grid of a reference RT Dose file.")
public class EyeplanToDicomCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "filename", description = "The Eyeplan dose workbook (.xlsx or .xls).")
    Path workbook;

    @Parameters(index = "1", paramLabel = "sourcedicom", description = "The reference RT Dose file.")
    Path reference;

    @Parameters(index = "2", paramLabel = "outputdicom", description = "The RT Dose file to write.")
    Path output;

    @Option(names = {"-d", "--debug"}, description = "Log the intermediate results.")
    boolean debug;

    @Option(names = "--extrapolation", description = "CLAMP or ERROR, for reference voxels outside the Eyeplan grid. Default: ${DEFAULT-VALUE}.")
    ResamplingOptions.Extrapolation extrapolation = ResamplingOptions.Extrapolation.CLAMP;

    @Option(names = "--tolerance", paramLabel = "mm", description = "Coordinate snapping tolerance. Default: ${DEFAULT-VALUE}.")
    double tolerance = ResamplingOptions.DEFAULT_TOLERANCE;

    @Option(names = "--bits", description = "16 or 32 bits per pixel. Default: ${DEFAULT-VALUE}.")
    int bits = PixelWidth.UINT32.bits;

    @Option(names = "--threads", description = "Resampling threads. Default: the ImageJ thread count.")
    Integer threads;

    @Option(names = "--axis-mapping", description = "EYEPLAN or IDENTITY. Default: ${DEFAULT-VALUE}.")
    AxisMapping axisMapping = AxisMapping.EYEPLAN;

    @Option(names = "--zero-threshold", description = "Doses below this are written as 0. Default: ${DEFAULT-VALUE}.")
    double zeroThreshold = EncodingOptions.DEFAULT_ZERO_THRESHOLD;

    @Option(names = "--dose-units", description = "GY or RELATIVE. Default: ${DEFAULT-VALUE}.")
    String doseUnits = ScalarField3D.DEFAULT_DOSE_UNITS;

    public static void main(String... args) {
        System.exit(execute(args));
    }

    /**
     * Run the command without exiting the JVM.
     * @return  The exit status.
     */
    public static int execute(String... args) {
        return new CommandLine(new EyeplanToDicomCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }

    ConversionOptions options() {
        ResamplingOptions defaults = ResamplingOptions.defaults();
        return new ConversionOptions(
                new ResamplingOptions(extrapolation, tolerance, threads == null ? defaults.getThreads() : threads),
                new EncodingOptions(PixelWidth.fromBits(bits), zeroThreshold, EncodingOptions.DEFAULT_PRECISION_FLOOR),
                axisMapping, doseUnits.toUpperCase(Locale.ROOT));
    }

    @Override
    public Integer call() {
        if (debug) IJ.debugMode = true;
        PrintWriter err = new PrintWriter(System.err, true);
        ConversionOptions options;
        try {
            options = options();
        } catch (IllegalArgumentException e) {
            err.println("Invalid option: " + e.getMessage());
            return 2;
        }
        if (debug) IJ.log("Conversion options: " + options);
        try {
            ConversionResult result = new EyeplanConversion(options).run(workbook, reference, output);
            System.out.println("Wrote " + output + " (" + result.getEncoded().sizeX() + "x"
                    + result.getEncoded().sizeY() + "x" + result.getEncoded().sizeZ()
                    + ", scaling " + result.getEncoded().getScaleFactor() + ")");
            return 0;
        } catch (IOException e) {
            err.println("Error: cannot read or write a file: " + e.getMessage());
        } catch (DicomException | DoseConversionException e) {
            err.println("Error: " + e.getMessage());
        }
        return 1;
    }
}
