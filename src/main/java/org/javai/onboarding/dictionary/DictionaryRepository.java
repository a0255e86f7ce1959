package org.javai.onboarding.dictionary;

import java.util.List;
import java.util.Optional;

/**
 * External attribute dictionary. Implementations may perform I/O and must honour the
 * {@link LookupContext} passed to every call.
 * <p>
 * The resolver only reads; the write operations exist for dictionary tooling.
 */
public interface DictionaryRepository {

	Optional<Attribute> getById(LookupContext context, String id);

	List<Attribute> getAll(LookupContext context);

	Optional<Attribute> findByName(LookupContext context, String name);

	void save(LookupContext context, Attribute attribute);

	/**
	 * @return whether an attribute was removed
	 */
	boolean delete(LookupContext context, String id);
}
