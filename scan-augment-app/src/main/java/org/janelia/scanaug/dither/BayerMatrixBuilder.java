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

/**
 * Builds dispersed-dot Bayer threshold matrices by recursive quad-tree subdivision.
 * <p>
 * Each level visits its quadrants in the order top-left, bottom-right, top-right, bottom-left,
 * adding <code>step * quadrantIndex</code> to the accumulated value and quadrupling the step
 * for the next level.  Changing the quadrant order changes the dither pattern.
 */
public class BayerMatrixBuilder {

    public static final int MAX_ORDER = 12;

    /**
     * @param  order  matrix order (side length is <code>2^order</code>).
     *
     * @return matrix with side length <code>2^order</code>.
     *
     * @throws IllegalArgumentException
     *   if the order is negative or larger than {@link #MAX_ORDER}.
     */
    public static BayerMatrix forOrder(final int order)
            throws IllegalArgumentException {
        if ((order < 0) || (order > MAX_ORDER)) {
            throw new IllegalArgumentException("order must be between 0 and " + MAX_ORDER + " (inclusive)");
        }
        return build(1 << order);
    }

    /**
     * @param  size  side length of the matrix.
     *
     * @return matrix containing each value in <code>[0, size² - 1]</code> exactly once.
     *
     * @throws IllegalArgumentException
     *   if the size is not a power of two.
     */
    public static BayerMatrix build(final int size)
            throws IllegalArgumentException {

        if ((size < 1) || (Integer.bitCount(size) != 1)) {
            throw new IllegalArgumentException("size " + size + " is not a power of two");
        }
        if (size > (1 << MAX_ORDER)) {
            throw new IllegalArgumentException("size " + size + " exceeds maximum of " + (1 << MAX_ORDER));
        }

        final int[][] matrix = new int[size][size];
        fill(matrix, 0, 0, size, 0, 1);
        return new BayerMatrix(matrix);
    }

    private static void fill(final int[][] matrix,
                             final int x,
                             final int y,
                             final int size,
                             final int value,
                             final int step) {
        if (size == 1) {
            matrix[y][x] = value;
            return;
        }

        final int half = size / 2;
        final int nextStep = step * 4;

        fill(matrix, x,        y,        half, value,            nextStep); // top-left
        fill(matrix, x + half, y + half, half, value + step,     nextStep); // bottom-right
        fill(matrix, x + half, y,        half, value + step * 2, nextStep); // top-right
        fill(matrix, x,        y + half, half, value + step * 3, nextStep); // bottom-left
    }

    private BayerMatrixBuilder() {
    }
}
