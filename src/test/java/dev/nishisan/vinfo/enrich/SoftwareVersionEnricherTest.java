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

import dev.nishisan.vinfo.cell.TextCell;
import dev.nishisan.vinfo.probe.ProbeException;
import dev.nishisan.vinfo.schema.EnrichmentPass;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SoftwareVersionEnricherTest {

    private final SoftwareVersionEnricher enricher = new SoftwareVersionEnricher(pkg -> {
        if (pkg.equals("broken")) {
            throw new ProbeException("dpkg locked");
        }
        return Optional.ofNullable(Map.of("indy-node", "1.12.4").get(pkg));
    });

    @Test
    void installedPackageReportsItsVersion() {
        TextCell cell = enricher.enrich("indy-node", TextCell.KIND.unknown(), new EnrichmentPass());
        assertEquals("1.12.4", cell.render());
    }

    @Test
    void missingPackageStaysUnknown() {
        assertTrue(enricher.enrich("sovrin", TextCell.KIND.unknown(), new EnrichmentPass()).isUnknown());
    }

    @Test
    void probeFailureStaysUnknown() {
        assertTrue(enricher.enrich("broken", TextCell.KIND.unknown(), new EnrichmentPass()).isUnknown());
    }
}
