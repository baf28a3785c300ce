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

import ij.Prefs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversionOptionsTest {
    private static final String[] KEYS = {
            ConversionOptions.KEY_EXTRAPOLATION, ConversionOptions.KEY_TOLERANCE, ConversionOptions.KEY_BITS,
            ConversionOptions.KEY_ZERO_THRESHOLD, ConversionOptions.KEY_PRECISION_FLOOR,
            ConversionOptions.KEY_AXIS_MAPPING, ConversionOptions.KEY_DOSE_UNITS};

    @AfterEach
    void clearPrefs() {
        for (String key : KEYS)
            Prefs.set(key, (String) null);
    }

    @Test
    void fromPrefs_readsWhatWasSaved() {
        new ConversionOptions(
                new ResamplingOptions(ResamplingOptions.Extrapolation.ERROR, 0.01, 1),
                new EncodingOptions(PixelWidth.UINT16, EncodingOptions.EYEPLAN_NOISE_FLOOR, 1e-9),
                AxisMapping.IDENTITY, "RELATIVE").saveToPrefs();

        ConversionOptions options = ConversionOptions.fromPrefs();

        assertThat(options.getResampling().getExtrapolation()).isEqualTo(ResamplingOptions.Extrapolation.ERROR);
        assertThat(options.getResampling().getToleranceEpsilon()).isEqualTo(0.01);
        assertThat(options.getEncoding().getPixelWidth()).isEqualTo(PixelWidth.UINT16);
        assertThat(options.getEncoding().getZeroThreshold()).isEqualTo(1e-11);
        assertThat(options.getEncoding().getPrecisionFloor()).isEqualTo(1e-9);
        assertThat(options.getAxisMapping()).isEqualTo(AxisMapping.IDENTITY);
        assertThat(options.getDoseUnits()).isEqualTo("RELATIVE");
    }

    @Test
    void fromPrefs_fallsBackToDefaultsForUnreadableEntries() {
        Prefs.set(ConversionOptions.KEY_BITS, 8);
        Prefs.set(ConversionOptions.KEY_EXTRAPOLATION, "WRAP");
        Prefs.set(ConversionOptions.KEY_TOLERANCE, -1.0);
        Prefs.set(ConversionOptions.KEY_ZERO_THRESHOLD, "lots");
        Prefs.set(ConversionOptions.KEY_AXIS_MAPPING, "IDENTITY");

        ConversionOptions options = ConversionOptions.fromPrefs();
        ConversionOptions defaults = ConversionOptions.defaults();

        assertThat(options.getEncoding().getPixelWidth()).isEqualTo(PixelWidth.UINT32);
        assertThat(options.getResampling().getExtrapolation()).isEqualTo(ResamplingOptions.Extrapolation.CLAMP);
        assertThat(options.getResampling().getToleranceEpsilon()).isEqualTo(ResamplingOptions.DEFAULT_TOLERANCE);
        assertThat(options.getEncoding().getZeroThreshold()).isEqualTo(defaults.getEncoding().getZeroThreshold());
        assertThat(options.getAxisMapping()).isEqualTo(AxisMapping.IDENTITY);
    }

    @Test
    void constructor_rejectsUnknownDoseUnits() {
        assertThatThrownBy(() -> new ConversionOptions(ResamplingOptions.defaults(), EncodingOptions.defaults(),
                AxisMapping.EYEPLAN, "CGY"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("CGY");
        assertThatThrownBy(() -> new ConversionOptions(ResamplingOptions.defaults(), EncodingOptions.defaults(),
                AxisMapping.EYEPLAN, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fromPrefs_ignoresUnknownDoseUnits() {
        Prefs.set(ConversionOptions.KEY_DOSE_UNITS, "SIEVERT");

        assertThat(ConversionOptions.fromPrefs().getDoseUnits()).isEqualTo("GY");
    }

    @Test
    void fromPrefs_withNothingSavedIsTheDefaults() {
        ConversionOptions options = ConversionOptions.fromPrefs();

        assertThat(options.getResampling().getExtrapolation()).isEqualTo(ResamplingOptions.Extrapolation.CLAMP);
        assertThat(options.getEncoding().getPixelWidth()).isEqualTo(PixelWidth.UINT32);
        assertThat(options.getEncoding().getZeroThreshold()).isZero();
        assertThat(options.getAxisMapping()).isEqualTo(AxisMapping.EYEPLAN);
        assertThat(options.getDoseUnits()).isEqualTo("GY");
    }
}
