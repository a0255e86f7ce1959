package org.javai.onboarding.dictionary;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Simple in-memory dictionary, intended for tests and local use.
 */
public class InMemoryDictionaryRepository implements DictionaryRepository {

	private final Map<String, Attribute> store = new ConcurrentHashMap<>();

	public InMemoryDictionaryRepository() {
	}

	public InMemoryDictionaryRepository(Collection<Attribute> attributes) {
		attributes.forEach(attribute -> store.put(attribute.id(), attribute));
	}

	@Override
	public Optional<Attribute> getById(LookupContext context, String id) {
		context.checkActive();
		return Optional.ofNullable(store.get(id));
	}

	@Override
	public List<Attribute> getAll(LookupContext context) {
		context.checkActive();
		return store.values().stream()
				.sorted(Comparator.comparing(Attribute::name))
				.toList();
	}

	@Override
	public Optional<Attribute> findByName(LookupContext context, String name) {
		context.checkActive();
		return store.values().stream()
				.filter(attribute -> attribute.name().equals(name))
				.findFirst();
	}

	@Override
	public void save(LookupContext context, Attribute attribute) {
		Objects.requireNonNull(attribute, "attribute must not be null");
		context.checkActive();
		store.put(attribute.id(), attribute);
	}

	@Override
	public boolean delete(LookupContext context, String id) {
		context.checkActive();
		return store.remove(id) != null;
	}

	public int size() {
		return store.size();
	}
}
