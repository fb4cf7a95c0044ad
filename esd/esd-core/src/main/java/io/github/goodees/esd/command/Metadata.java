package io.github.goodees.esd.command;

/*-
 * #%L
 * esd
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable, ordered list of {@link Metadatum}. Names need not be unique. Every modification returns a new instance.
 */
public final class Metadata implements Iterable<Metadatum> {
    public static final Metadata NONE = new Metadata(Collections.emptyList());

    private final List<Metadatum> items;

    public Metadata(Iterable<Metadatum> items) {
        Objects.requireNonNull(items, "Metadata must be specified");
        List<Metadatum> copy = new ArrayList<>();
        for (Metadatum item : items) {
            copy.add(Objects.requireNonNull(item, "Metadatum must not be null"));
        }
        this.items = Collections.unmodifiableList(copy);
    }

    public Metadata with(Metadatum metadatum) {
        Objects.requireNonNull(metadatum, "Metadatum must be specified");
        List<Metadatum> result = new ArrayList<>(items);
        result.add(metadatum);
        return new Metadata(result);
    }

    public Metadata with(String name, String value) {
        return with(new Metadatum(name, value));
    }

    public Metadata with(Iterable<Metadatum> metadata) {
        Objects.requireNonNull(metadata, "Metadata must be specified");
        List<Metadatum> result = new ArrayList<>(items);
        metadata.forEach(result::add);
        return new Metadata(result);
    }

    /**
     * Remove every occurrence of the exact pair.
     * @param metadatum pair to remove
     * @return metadata without the pair
     */
    public Metadata without(Metadatum metadatum) {
        Objects.requireNonNull(metadatum, "Metadatum must be specified");
        return new Metadata(items.stream().filter(m -> !m.equals(metadatum)).collect(Collectors.toList()));
    }

    /**
     * Remove all pairs of given name.
     * @param name name to remove
     * @return metadata without pairs of that name
     */
    public Metadata without(String name) {
        Objects.requireNonNull(name, "Name must be specified");
        return new Metadata(items.stream().filter(m -> !m.getName().equals(name)).collect(Collectors.toList()));
    }

    public List<Map.Entry<String, String>> toKeyValuePairs() {
        return items.stream()
                .map(m -> new AbstractMap.SimpleImmutableEntry<>(m.getName(), m.getValue()))
                .collect(Collectors.toList());
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    @Override
    public Iterator<Metadatum> iterator() {
        return items.iterator();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Metadata && items.equals(((Metadata) o).items));
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return "Metadata" + items;
    }
}
