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

package dev.nishisan.vinfo.enrich;

import dev.nishisan.vinfo.cell.EnabledCell;
import dev.nishisan.vinfo.probe.EnabledState;
import dev.nishisan.vinfo.probe.ProbeException;
import dev.nishisan.vinfo.probe.ProcessControlProbe;
import dev.nishisan.vinfo.schema.EnrichmentPass;
import dev.nishisan.vinfo.schema.FieldEnricher;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fills an unknown enabled flag from the process control plane.
 */
public final class EnabledStateEnricher implements FieldEnricher<EnabledCell> {
    private static final Logger LOGGER = Logger.getLogger(EnabledStateEnricher.class.getName());

    private final ProcessControlProbe processControl;

    public EnabledStateEnricher(ProcessControlProbe processControl) {
        this.processControl = Objects.requireNonNull(processControl, "processControl");
    }

    @Override
    public EnabledCell enrich(String fieldName, EnabledCell unknown, EnrichmentPass pass) {
        try {
            EnabledState state = processControl.getEnabledState();
            return state.flag() == null ? unknown : new EnabledCell(state.flag());
        } catch (ProbeException e) {
            LOGGER.log(Level.WARNING, "Enabled state probe failed for field " + fieldName, e);
            return unknown;
        }
    }
}
