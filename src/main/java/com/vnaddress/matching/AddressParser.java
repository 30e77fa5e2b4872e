package com.vnaddress.matching;

import com.vnaddress.gazetteer.Gazetteer;
import com.vnaddress.processing.AddressNormalizer;
import com.vnaddress.processing.InvalidAddressInputException;

import java.util.List;

/**
 * Entry point for the invoice pipeline: normalizes raw address text and resolves its
 * province, district and ward against a gazetteer.
 *
 * <p>Stateless over immutable collaborators, so one instance can serve any number of threads.</p>
 */
public class AddressParser {

    private final AddressNormalizer normalizer;
    private final HierarchicalResolver resolver;

    public AddressParser(Gazetteer gazetteer) {
        this(new AddressNormalizer(), new HierarchicalResolver(gazetteer));
    }

    public AddressParser(AddressNormalizer normalizer, HierarchicalResolver resolver) {
        if (normalizer == null || resolver == null) {
            throw new IllegalArgumentException("Normalizer and resolver are required");
        }
        this.normalizer = normalizer;
        this.resolver = resolver;
    }

    /**
     * @param rawAddress address text as produced by OCR
     * @return the resolution; unresolved levels are empty, never an exception
     * @throws InvalidAddressInputException if {@code rawAddress} is null
     */
    public ResolutionResult parse(String rawAddress) {
        return resolver.resolve(normalizer.normalize(rawAddress));
    }

    /**
     * Same as {@link #parse(String)}, rendered as {@code <remainder> <ward>, <district>, <province>}.
     */
    public String parseToString(String rawAddress) {
        return parse(rawAddress).format();
    }

    /**
     * Parses a batch in parallel. Results are returned in input order.
     */
    public List<ResolutionResult> parseAll(List<String> rawAddresses) {
        if (rawAddresses == null) {
            throw new InvalidAddressInputException("The address list must not be null");
        }
        return rawAddresses.parallelStream()
                .map(this::parse)
                .toList();
    }

    public AddressNormalizer getNormalizer() {
        return normalizer;
    }
}
