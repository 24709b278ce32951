/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura at gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */

package dev.nishisan.vinfo.cell;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import dev.nishisan.vinfo.JsonSupport;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A typed, nullable value of a validator record field.
 * <p>
 * A cell is unknown if and only if its raw value is {@code null}. Present but falsy values
 * (zero, empty list, {@code false}) are never unknown.
 * <p>
 * Rendering never throws: a formatting failure is logged and degrades to the unknown
 * placeholder.
 *
 * @param <T> the raw value type
 */
public abstract class ValueCell<T> {
    private static final Logger LOGGER = Logger.getLogger(ValueCell.class.getName());

    /** Placeholder rendered for unknown values. */
    public static final String UNKNOWN = "unknown";

    private final T value;

    protected ValueCell(T value) {
        this.value = value;
    }

    /**
     * Returns the raw value, or {@code null} when unknown.
     *
     * @return the raw value
     */
    public T rawValue() {
        return value;
    }

    /**
     * Returns whether the value is absent.
     *
     * @return {@code true} when no value is known
     */
    public boolean isUnknown() {
        return value == null;
    }

    /**
     * Renders the value for human consumption.
     *
     * @return the rendered text, or the unknown placeholder
     */
    public final String render() {
        if (value == null) {
            return unknownText();
        }
        try {
            return format(value);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Failed to render " + getClass().getSimpleName() + " value " + value, e);
            return unknownText();
        }
    }

    /**
     * Returns the normalized JSON form of this cell. Unknown cells serialize to {@code null}.
     *
     * @return the JSON node
     */
    public JsonNode toJson() {
        if (value == null) {
            return NullNode.getInstance();
        }
        return JsonSupport.MAPPER.valueToTree(value);
    }

    protected String unknownText() {
        return UNKNOWN;
    }

    protected abstract String format(T value);

    @Override
    public String toString() {
        return render();
    }
}
