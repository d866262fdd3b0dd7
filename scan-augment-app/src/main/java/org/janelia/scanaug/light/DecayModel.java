/**
 * License: GPL
 *
 * This program is free software; you can redistribute it and/or
 * modify it under the terms of the GNU General Public License 2
 * as published by the Free Software Foundation.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program; if not, write to the Free Software
 * Foundation, Inc., 59 Temple Place - Suite 330, Boston, MA  02111-1307, USA.
 */
package org.janelia.scanaug.light;

/**
 * Brightness as a function of the distance between a canvas row and the light source row.
 */
public interface DecayModel {

    /**
     * @param  row        canvas row.
     * @param  centerRow  canvas row containing the light source.
     *
     * @return (unclamped) brightness for the row.
     */
    double valueAt(final double row,
                   final double centerRow);

    /**
     * Decays from the maximum to the minimum value following a normal distribution.
     */
    class Gaussian implements DecayModel {

        private final double maxValue;
        private final double minValue;
        private final double sigma;

        /**
         * @param  maxValue  value at the light source row.
         * @param  minValue  value approached far from the light source.
         * @param  range     extent of the decay axis, the standard deviation is a third of it.
         */
        public Gaussian(final double maxValue,
                        final double minValue,
                        final double range) {
            this.maxValue = maxValue;
            this.minValue = minValue;
            this.sigma = range / 3.0;
        }

        public double getSigma() {
            return sigma;
        }

        @Override
        public double valueAt(final double row,
                              final double centerRow) {
            // pdf(row) / pdf(center) for a normal distribution centered on the light row
            final double delta = row - centerRow;
            final double ratio = Math.exp(-(delta * delta) / (2.0 * sigma * sigma));
            return ratio * (maxValue - minValue) + minValue;
        }
    }

    /**
     * Decays linearly from the maximum value, never dropping below 1.
     */
    class Linear implements DecayModel {

        private final double maxValue;
        private final double decayRate;

        public Linear(final double maxValue,
                      final double decayRate) {
            this.maxValue = maxValue;
            this.decayRate = decayRate;
        }

        public double getDecayRate() {
            return decayRate;
        }

        @Override
        public double valueAt(final double row,
                              final double centerRow) {
            final double value = maxValue - Math.abs(centerRow - row) * decayRate;
            return Math.max(value, 1.0);
        }
    }

}
