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

package dev.nishisan.vinfo.probe;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link PackageVersionProbe} using {@code dpkg-query -W -f=${Version}}. A non-zero exit means the
 * package is unknown to dpkg.
 */
public final class DpkgPackageVersionProbe implements PackageVersionProbe {

    private final CommandRunner runner;

    public DpkgPackageVersionProbe(CommandRunner runner) {
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    @Override
    public Optional<String> getInstalledVersion(String packageName) throws ProbeException {
        CommandResult result = runner.run(List.of("dpkg-query", "-W", "-f=${Version}", packageName));
        if (!result.succeeded()) {
            return Optional.empty();
        }
        String version = result.stdout().trim();
        return version.isEmpty() ? Optional.empty() : Optional.of(version);
    }
}
