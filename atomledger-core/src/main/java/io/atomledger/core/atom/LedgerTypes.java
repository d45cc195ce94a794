package io.atomledger.core.atom;

import io.atomledger.core.serialization.Output;
import io.atomledger.core.serialization.Serialization;
import io.atomledger.core.serialization.TypeRegistry;
import io.atomledger.core.serialization.TypeSchema;

import java.util.List;

import static io.atomledger.core.serialization.ValueCodecs.BYTES;
import static io.atomledger.core.serialization.ValueCodecs.IDENTIFIER;
import static io.atomledger.core.serialization.ValueCodecs.LONG;
import static io.atomledger.core.serialization.ValueCodecs.STRING;
import static io.atomledger.core.serialization.ValueCodecs.UINT256;
import static io.atomledger.core.serialization.ValueCodecs.enumeration;
import static io.atomledger.core.serialization.ValueCodecs.euidMap;
import static io.atomledger.core.serialization.ValueCodecs.list;
import static io.atomledger.core.serialization.ValueCodecs.object;
import static io.atomledger.core.serialization.ValueCodecs.stringMap;
import static io.atomledger.core.serialization.ValueCodecs.unorderedList;

/**
 * Schemas of the built-in ledger types and the default registry holding them.
 */
public final class LedgerTypes {

    public static final TypeSchema<FungibleQuark> FUNGIBLE_QUARK =
            TypeSchema.builder("FUNGIBLEQUARK", FungibleQuark.class)
                    .field("amount", UINT256, FungibleQuark::amount)
                    .field("planck", LONG, FungibleQuark::planck)
                    .field("nonce", LONG, FungibleQuark::nonce)
                    .field("type", enumeration(FungibleType.class, FungibleType::value, FungibleType::fromValue),
                            FungibleQuark::type)
                    .factory(v -> new FungibleQuark(v.get("amount"), v.<Long>get("planck"), v.<Long>get("nonce"),
                            v.get("type")))
                    .build();

    public static final TypeSchema<OwnableQuark> OWNABLE_QUARK =
            TypeSchema.builder("OWNABLEQUARK", OwnableQuark.class)
                    .field("owner", BYTES, OwnableQuark::owner)
                    .factory(v -> new OwnableQuark(v.get("owner")))
                    .build();

    public static final TypeSchema<IdentifiableQuark> IDENTIFIABLE_QUARK =
            TypeSchema.builder("IDENTIFIABLEQUARK", IdentifiableQuark.class)
                    .field("id", STRING, IdentifiableQuark::id)
                    .factory(v -> new IdentifiableQuark(v.get("id")))
                    .build();

    public static final TypeSchema<AccountableQuark> ACCOUNTABLE_QUARK =
            TypeSchema.builder("ACCOUNTABLEQUARK", AccountableQuark.class)
                    .field("addresses", list(STRING), AccountableQuark::addresses)
                    .factory(v -> new AccountableQuark(v.get("addresses")))
                    .build();

    public static final TypeSchema<ChronoQuark> CHRONO_QUARK =
            TypeSchema.builder("CHRONOQUARK", ChronoQuark.class)
                    .field("timeKey", STRING, ChronoQuark::timeKey)
                    .field("timestamp", LONG, ChronoQuark::timestamp)
                    .factory(v -> new ChronoQuark(v.get("timeKey"), v.<Long>get("timestamp")))
                    .build();

    public static final TypeSchema<TokenDefinitionParticle> TOKEN_DEFINITION_PARTICLE =
            TypeSchema.builder("TOKENDEFINITIONPARTICLE", TokenDefinitionParticle.class)
                    .field("name", STRING, TokenDefinitionParticle::name)
                    .field("description", STRING, TokenDefinitionParticle::description)
                    .field("granularity", UINT256, TokenDefinitionParticle::granularity)
                    .field("quarks", list(object(Quark.class)), TokenDefinitionParticle::quarks)
                    .factory(v -> new TokenDefinitionParticle(v.get("name"), v.get("description"),
                            v.get("granularity"), v.get("quarks")))
                    .build();

    public static final TypeSchema<TransferParticle> TRANSFER_PARTICLE =
            TypeSchema.builder("TRANSFERPARTICLE", TransferParticle.class)
                    .field("tokenReference", STRING, TransferParticle::tokenReference)
                    .field("quarks", list(object(Quark.class)), TransferParticle::quarks)
                    .factory(v -> new TransferParticle(v.get("tokenReference"), v.get("quarks")))
                    .build();

    public static final TypeSchema<OwnershipParticle> OWNERSHIP_PARTICLE =
            TypeSchema.builder("OWNERSHIPPARTICLE", OwnershipParticle.class)
                    .field("quarks", list(object(Quark.class)), OwnershipParticle::quarks)
                    .factory(v -> new OwnershipParticle(v.get("quarks")))
                    .build();

    public static final TypeSchema<MessageParticle> MESSAGE_PARTICLE =
            TypeSchema.builder("MESSAGEPARTICLE", MessageParticle.class)
                    .field("from", STRING, MessageParticle::from)
                    .field("to", STRING, MessageParticle::to)
                    .field("data", BYTES, MessageParticle::data)
                    .optionalField("metaData", stringMap(STRING), MessageParticle::metaData)
                    .field("quarks", list(object(Quark.class)), MessageParticle::quarks)
                    .factory(v -> new MessageParticle(v.get("from"), v.get("to"), v.get("data"),
                            v.get("metaData"), v.get("quarks")))
                    .build();

    public static final TypeSchema<Atom> ATOM =
            TypeSchema.builder("ATOM", Atom.class)
                    .field("particles", unorderedList(object(Particle.class)), Atom::particles)
                    .optionalField("timestamps", stringMap(LONG), Atom::timestamps)
                    .optionalField("signatures", euidMap(BYTES), Atom::signatures, Output.WIRE)
                    .derivedField("hid", IDENTIFIER, (atom, s) -> s.hid(atom), Output.WIRE)
                    .factory(v -> new Atom(v.get("particles"), v.get("timestamps"), v.get("signatures")))
                    .build();

    public static final List<TypeSchema<?>> ALL = List.of(
            FUNGIBLE_QUARK, OWNABLE_QUARK, IDENTIFIABLE_QUARK, ACCOUNTABLE_QUARK, CHRONO_QUARK,
            TOKEN_DEFINITION_PARTICLE, TRANSFER_PARTICLE, OWNERSHIP_PARTICLE, MESSAGE_PARTICLE, ATOM);

    private LedgerTypes() {}

    /**
     * Adds every built-in schema to {@code builder}, for registries that extend the built-in set.
     */
    public static TypeRegistry.Builder registerAll(TypeRegistry.Builder builder) {
        return builder.registerAll(ALL);
    }

    /**
     * The registry of built-in types. Built once.
     */
    public static TypeRegistry registry() {
        return Holder.REGISTRY;
    }

    /**
     * A serializer over {@link #registry()}. Built once.
     */
    public static Serialization serialization() {
        return Holder.SERIALIZATION;
    }

    private static final class Holder {
        static final TypeRegistry REGISTRY = registerAll(TypeRegistry.builder()).build();
        static final Serialization SERIALIZATION = new Serialization(REGISTRY);
    }
}
