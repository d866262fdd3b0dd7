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
package org.janelia.scanaug.filter;

import ij.process.ImageProcessor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

import org.janelia.scanaug.dither.ErrorDiffusionDitherer;
import org.janelia.scanaug.dither.OrderedDitherer;

/**
 * Applies ordered (Bayer matrix) or Floyd-Steinberg (error diffusion) dithering.
 */
public class DitheringFilter
        implements Filter {

    public enum DitherType {
        ORDERED,
        FLOYD_STEINBERG;

        public static DitherType fromString(final String dither) {
            if (dither != null) {
                final String normalized = dither.trim().replace('-', '_');
                for (final DitherType type : values()) {
                    if (type.name().equalsIgnoreCase(normalized)) {
                        return type;
                    }
                }
                if ("floyd".equalsIgnoreCase(normalized)) {
                    return FLOYD_STEINBERG;
                }
            }
            throw new IllegalArgumentException("unknown dither type: " + dither);
        }
    }

    public static final int DEFAULT_ORDER = 5;

    private DitherType ditherType;
    private int order;

    private transient OrderedDitherer orderedDitherer;
    private transient ErrorDiffusionDitherer errorDiffusionDitherer;

    // empty constructor required to create instances from specifications
    @SuppressWarnings("unused")
    public DitheringFilter() {
        this(DitherType.ORDERED, DEFAULT_ORDER);
    }

    public DitheringFilter(final DitherType ditherType,
                           final int order) {
        setup(ditherType, order);
    }

    private void setup(final DitherType ditherType,
                       final int order) {
        if (ditherType == null) {
            throw new IllegalArgumentException("dither type must be defined");
        }
        this.ditherType = ditherType;
        this.order = order;
        this.orderedDitherer = null;
        this.errorDiffusionDitherer = null;
        if (ditherType == DitherType.ORDERED) {
            // builds (and validates) the threshold matrix up front
            this.orderedDitherer = new OrderedDitherer(order);
        } else {
            this.errorDiffusionDitherer = new ErrorDiffusionDitherer();
        }
    }

    public DitherType getDitherType() {
        return ditherType;
    }

    public int getOrder() {
        return order;
    }

    @Override
    public void init(final Map<String, String> params) {
        final DitherType type = DitherType.fromString(Filter.getStringParameter("dither", params, "ordered"));
        final String orderString = Filter.getStringParameter("order", params, String.valueOf(DEFAULT_ORDER));
        final int parsedOrder;
        try {
            parsedOrder = Integer.parseInt(orderString.trim());
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("failed to parse 'order' parameter", e);
        }
        setup(type, parsedOrder);
    }

    @Override
    public Map<String, String> toParametersMap() {
        final Map<String, String> map = new LinkedHashMap<>();
        map.put("dither", ditherType.name().toLowerCase());
        map.put("order", String.valueOf(order));
        return map;
    }

    @Override
    public ImageProcessor process(final ImageProcessor ip,
                                  final Random random) {
        if (orderedDitherer == null && errorDiffusionDitherer == null) {
            // transient ditherers are lost when an instance is deserialized
            setup(ditherType, order);
        }
        return ditherType == DitherType.ORDERED ? orderedDitherer.dither(ip) : errorDiffusionDitherer.dither(ip);
    }
}
