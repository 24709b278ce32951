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

import dev.nishisan.vinfo.cell.StateCell;
import dev.nishisan.vinfo.probe.ProbeException;
import dev.nishisan.vinfo.probe.ProcessControlProbe;
import dev.nishisan.vinfo.probe.RunState;
import dev.nishisan.vinfo.schema.EnrichmentPass;
import dev.nishisan.vinfo.schema.FieldEnricher;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fills an unknown run state from the process control plane.
 */
public final class RunStateEnricher implements FieldEnricher<StateCell> {
    private static final Logger LOGGER = Logger.getLogger(RunStateEnricher.class.getName());

    private final ProcessControlProbe processControl;

    public RunStateEnricher(ProcessControlProbe processControl) {
        this.processControl = Objects.requireNonNull(processControl, "processControl");
    }

    @Override
    public StateCell enrich(String fieldName, StateCell unknown, EnrichmentPass pass) {
        try {
            RunState state = processControl.getRunState();
            return state.label() == null ? unknown : new StateCell(state.label());
        } catch (ProbeException e) {
            LOGGER.log(Level.WARNING, "Run state probe failed for field " + fieldName, e);
            return unknown;
        }
    }
}
