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
package org.janelia.scanaug.dither;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Square threshold matrix used for ordered dithering.
 * Instances are immutable, {@link #toArray()} returns a copy of the values.
 */
public class BayerMatrix
        implements Serializable {

    private final int[][] values;

    BayerMatrix(final int[][] values) {
        this.values = values;
    }

    public int getSize() {
        return values.length;
    }

    /**
     * @return threshold at the specified row and column (no tiling is applied).
     */
    public int get(final int row,
                   final int column) {
        return values[row][column];
    }

    /**
     * @return threshold for the specified image pixel with the matrix tiled across the image.
     */
    public int getTiled(final int x,
                        final int y) {
        final int size = values.length;
        return values[y % size][x % size];
    }

    /**
     * Rescales the (raw) matrix values into the 8-bit intensity range using
     * <code>floor(value / (size² - 1) * 255)</code>.
     *
     * @return new normalized matrix.
     *
     * @throws IllegalStateException
     *   if this matrix has a single cell (no range to rescale).
     */
    public BayerMatrix normalize()
            throws IllegalStateException {

        final int size = values.length;
        final int totalNumber = size * size - 1;
        if (totalNumber < 1) {
            throw new IllegalStateException("cannot normalize a " + size + "x" + size + " matrix");
        }

        final int[][] normalized = new int[size][size];
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                normalized[y][x] = (int) Math.floor(((double) values[y][x] / totalNumber) * 255);
            }
        }
        return new BayerMatrix(normalized);
    }

    public int[][] toArray() {
        final int[][] copy = new int[values.length][];
        for (int y = 0; y < values.length; y++) {
            copy[y] = values[y].clone();
        }
        return copy;
    }

    @Override
    public String toString() {
        return Arrays.deepToString(values);
    }
}
