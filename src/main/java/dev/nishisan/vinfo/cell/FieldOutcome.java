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

import java.util.Objects;
import java.util.Optional;

/**
 * Result of constructing one record field from its raw JSON value.
 * <p>
 * A {@link #parsed(ValueCell) parsed} outcome carries the constructed cell (which may itself be
 * unknown when the raw value was absent). A {@link #malformed(String) malformed} outcome carries the
 * reason the raw value was rejected; the caller substitutes an unknown cell.
 *
 * @param <C> the cell type
 */
public final class FieldOutcome<C extends ValueCell<?>> {
    private final C cell;
    private final String reason;

    private FieldOutcome(C cell, String reason) {
        this.cell = cell;
        this.reason = reason;
    }

    public static <C extends ValueCell<?>> FieldOutcome<C> parsed(C cell) {
        return new FieldOutcome<>(Objects.requireNonNull(cell, "cell"), null);
    }

    public static <C extends ValueCell<?>> FieldOutcome<C> malformed(String reason) {
        return new FieldOutcome<>(null, Objects.requireNonNull(reason, "reason"));
    }

    public boolean isMalformed() {
        return cell == null;
    }

    public Optional<C> cell() {
        return Optional.ofNullable(cell);
    }

    public String reason() {
        return reason;
    }
}
