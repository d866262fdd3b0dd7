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
 * Supported laws for brightness falloff away from the light source row.
 */
public enum DecayMode {

    /** Normal distribution ratio scaled between the minimum and maximum brightness. */
    GAUSSIAN("gaussian"),

    /** Linear decay with a configured (or randomly drawn) rate. */
    LINEAR_STATIC("linear_static"),

    /** Linear decay with a rate derived from the brightness range and mask size. */
    LINEAR_DYNAMIC("linear_dynamic");

    private final String configName;

    DecayMode(final String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * @param  mode  configuration name (e.g. "linear_static") or enum name of the mode.
     *
     * @return the corresponding mode.
     *
     * @throws IllegalArgumentException
     *   if the mode is not supported.
     */
    public static DecayMode fromString(final String mode)
            throws IllegalArgumentException {
        if (mode != null) {
            for (final DecayMode decayMode : values()) {
                if (decayMode.configName.equalsIgnoreCase(mode) || decayMode.name().equalsIgnoreCase(mode)) {
                    return decayMode;
                }
            }
        }
        throw new IllegalArgumentException("unsupported mode '" + mode +
                                           "', mode must be linear_dynamic, linear_static or gaussian");
    }
}
