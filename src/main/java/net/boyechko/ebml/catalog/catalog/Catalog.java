/*
 * EBML-Catalog - EBML/Matroska schema catalog generator
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.ebml.catalog.catalog;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The finished, deterministically ordered catalog handed to an emitter. Emitters render it as is;
 * they must not reorder or deduplicate.
 */
public record Catalog(List<ElementDefinition> elements, List<TagDefinition> tags) {
    public Catalog {
        elements = List.copyOf(elements);
        tags = List.copyOf(tags);
    }

    public Optional<ElementDefinition> element(String name) {
        return elements.stream().filter(e -> e.name().equals(name)).findFirst();
    }

    public List<ElementDefinition> masters() {
        return elements.stream().filter(ElementDefinition::isMaster).collect(Collectors.toList());
    }

    public List<ElementDefinition> roots() {
        return elements.stream().filter(ElementDefinition::root).collect(Collectors.toList());
    }

    public int enumerationCount() {
        return elements.stream().mapToInt(e -> e.enumerations().size()).sum();
    }
}
