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
import dev.nishisan.vinfo.probe.PackageVersionProbe;
import dev.nishisan.vinfo.probe.ProbeException;
import dev.nishisan.vinfo.schema.EnrichmentPass;
import dev.nishisan.vinfo.schema.FieldEnricher;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fills an unknown package version with the locally installed one. The field name is the package
 * name.
 */
public final class SoftwareVersionEnricher implements FieldEnricher<TextCell> {
    private static final Logger LOGGER = Logger.getLogger(SoftwareVersionEnricher.class.getName());

    private final PackageVersionProbe packages;

    public SoftwareVersionEnricher(PackageVersionProbe packages) {
        this.packages = Objects.requireNonNull(packages, "packages");
    }

    @Override
    public TextCell enrich(String packageName, TextCell unknown, EnrichmentPass pass) {
        Optional<String> version;
        try {
            version = packages.getInstalledVersion(packageName);
        } catch (ProbeException e) {
            LOGGER.log(Level.WARNING, "Version lookup for package " + packageName + " failed", e);
            return unknown;
        }
        if (version.isEmpty()) {
            LOGGER.warning(() -> "Package " + packageName + " is not installed, version unknown");
            return unknown;
        }
        return new TextCell(version.get());
    }
}
