package org.wordnet.lexical.common;

import static java.util.Collections.unmodifiableMap;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Relation vocabulary of the Global WordNet Association WN-LMF 1.x schema.
 *
 * <p>Each constant knows its LMF name, where it may appear (on synsets, on
 * senses or both) and its inverse. Symmetric relations are their own inverse.
 * A handful of relations (pertainym, other, the dc_ and morphosemantic
 * extensions) have no declared inverse.
 */
public enum RelationType {
    // synset relations
    AGENT("agent", Scope.BOTH),
    ALSO("also", Scope.BOTH),
    ATTRIBUTE("attribute", Scope.SYNSET),
    BE_IN_STATE("be_in_state", Scope.SYNSET),
    CAUSES("causes", Scope.SYNSET),
    CLASSIFIED_BY("classified_by", Scope.SYNSET),
    CLASSIFIES("classifies", Scope.SYNSET),
    CO_AGENT_INSTRUMENT("co_agent_instrument", Scope.SYNSET),
    CO_AGENT_PATIENT("co_agent_patient", Scope.SYNSET),
    CO_AGENT_RESULT("co_agent_result", Scope.SYNSET),
    CO_INSTRUMENT_AGENT("co_instrument_agent", Scope.SYNSET),
    CO_INSTRUMENT_PATIENT("co_instrument_patient", Scope.SYNSET),
    CO_INSTRUMENT_RESULT("co_instrument_result", Scope.SYNSET),
    CO_PATIENT_AGENT("co_patient_agent", Scope.SYNSET),
    CO_PATIENT_INSTRUMENT("co_patient_instrument", Scope.SYNSET),
    CO_RESULT_AGENT("co_result_agent", Scope.SYNSET),
    CO_RESULT_INSTRUMENT("co_result_instrument", Scope.SYNSET),
    CO_ROLE("co_role", Scope.SYNSET),
    DIRECTION("direction", Scope.SYNSET),
    DOMAIN_REGION("domain_region", Scope.BOTH),
    DOMAIN_TOPIC("domain_topic", Scope.BOTH),
    EXEMPLIFIES("exemplifies", Scope.BOTH),
    ENTAILS("entails", Scope.SYNSET),
    EQ_SYNONYM("eq_synonym", Scope.SYNSET),
    HAS_DOMAIN_REGION("has_domain_region", Scope.BOTH),
    HAS_DOMAIN_TOPIC("has_domain_topic", Scope.BOTH),
    IS_EXEMPLIFIED_BY("is_exemplified_by", Scope.BOTH),
    HOLO_LOCATION("holo_location", Scope.SYNSET),
    HOLO_MEMBER("holo_member", Scope.SYNSET),
    HOLO_PART("holo_part", Scope.SYNSET),
    HOLO_PORTION("holo_portion", Scope.SYNSET),
    HOLO_SUBSTANCE("holo_substance", Scope.SYNSET),
    HOLONYM("holonym", Scope.SYNSET),
    HYPERNYM("hypernym", Scope.SYNSET),
    HYPONYM("hyponym", Scope.SYNSET),
    IN_MANNER("in_manner", Scope.SYNSET),
    INSTANCE_HYPERNYM("instance_hypernym", Scope.SYNSET),
    INSTANCE_HYPONYM("instance_hyponym", Scope.SYNSET),
    INSTRUMENT("instrument", Scope.BOTH),
    INVOLVED("involved", Scope.SYNSET),
    INVOLVED_AGENT("involved_agent", Scope.BOTH),
    INVOLVED_DIRECTION("involved_direction", Scope.SYNSET),
    INVOLVED_INSTRUMENT("involved_instrument", Scope.BOTH),
    INVOLVED_LOCATION("involved_location", Scope.BOTH),
    INVOLVED_PATIENT("involved_patient", Scope.BOTH),
    INVOLVED_RESULT("involved_result", Scope.BOTH),
    INVOLVED_SOURCE_DIRECTION("involved_source_direction", Scope.SYNSET),
    INVOLVED_TARGET_DIRECTION("involved_target_direction", Scope.SYNSET),
    IS_CAUSED_BY("is_caused_by", Scope.SYNSET),
    IS_ENTAILED_BY("is_entailed_by", Scope.SYNSET),
    LOCATION("location", Scope.BOTH),
    MANNER_OF("manner_of", Scope.SYNSET),
    MERO_LOCATION("mero_location", Scope.SYNSET),
    MERO_MEMBER("mero_member", Scope.SYNSET),
    MERO_PART("mero_part", Scope.SYNSET),
    MERO_PORTION("mero_portion", Scope.SYNSET),
    MERO_SUBSTANCE("mero_substance", Scope.SYNSET),
    MERONYM("meronym", Scope.SYNSET),
    SIMILAR("similar", Scope.BOTH),
    OTHER("other", Scope.BOTH),
    PATIENT("patient", Scope.BOTH),
    RESTRICTED_BY("restricted_by", Scope.SYNSET),
    RESTRICTS("restricts", Scope.SYNSET),
    RESULT("result", Scope.BOTH),
    ROLE("role", Scope.SYNSET),
    SOURCE_DIRECTION("source_direction", Scope.SYNSET),
    STATE_OF("state_of", Scope.SYNSET),
    TARGET_DIRECTION("target_direction", Scope.SYNSET),
    SUBEVENT("subevent", Scope.SYNSET),
    IS_SUBEVENT_OF("is_subevent_of", Scope.SYNSET),
    ANTONYM("antonym", Scope.BOTH),
    FEMININE("feminine", Scope.BOTH),
    HAS_FEMININE("has_feminine", Scope.BOTH),
    MASCULINE("masculine", Scope.BOTH),
    HAS_MASCULINE("has_masculine", Scope.BOTH),
    YOUNG("young", Scope.BOTH),
    HAS_YOUNG("has_young", Scope.BOTH),
    DIMINUTIVE("diminutive", Scope.BOTH),
    HAS_DIMINUTIVE("has_diminutive", Scope.BOTH),
    AUGMENTATIVE("augmentative", Scope.BOTH),
    HAS_AUGMENTATIVE("has_augmentative", Scope.BOTH),
    ANTO_GRADABLE("anto_gradable", Scope.BOTH),
    ANTO_SIMPLE("anto_simple", Scope.BOTH),
    ANTO_CONVERSE("anto_converse", Scope.BOTH),
    IR_SYNONYM("ir_synonym", Scope.SYNSET),
    // sense only
    DERIVATION("derivation", Scope.SENSE),
    PERTAINYM("pertainym", Scope.SENSE),
    PARTICIPLE("participle", Scope.SENSE),
    SIMPLE_ASPECT_IP("simple_aspect_ip", Scope.SENSE),
    SECONDARY_ASPECT_IP("secondary_aspect_ip", Scope.SENSE),
    SIMPLE_ASPECT_PI("simple_aspect_pi", Scope.SENSE),
    SECONDARY_ASPECT_PI("secondary_aspect_pi", Scope.SENSE),
    METONYM("metonym", Scope.SENSE),
    HAS_METONYM("has_metonym", Scope.SENSE),
    // morphosemantic links
    EVENT("event", Scope.SENSE),
    BODY_PART("body_part", Scope.SENSE),
    BY_MEANS_OF("by_means_of", Scope.SENSE),
    MATERIAL("material", Scope.SENSE),
    PROPERTY("property", Scope.SENSE),
    STATE("state", Scope.SENSE),
    UNDERGOER("undergoer", Scope.SENSE),
    USES("uses", Scope.SENSE),
    VEHICLE("vehicle", Scope.SENSE);

    /**
     * Where a relation may be declared.
     */
    public enum Scope {
        SYNSET,
        SENSE,
        BOTH
    }

    private static final Map<String, RelationType> BY_NAME;
    private static final Map<RelationType, RelationType> INVERSES;

    static {
        Map<String, RelationType> byName = new HashMap<>();
        for (RelationType type : values()) {
            byName.put(type.lmfName, type);
        }
        BY_NAME = unmodifiableMap(byName);

        Map<RelationType, RelationType> inverses = new HashMap<>();
        pair(inverses, HYPERNYM, HYPONYM);
        pair(inverses, INSTANCE_HYPERNYM, INSTANCE_HYPONYM);
        pair(inverses, MERONYM, HOLONYM);
        pair(inverses, MERO_LOCATION, HOLO_LOCATION);
        pair(inverses, MERO_MEMBER, HOLO_MEMBER);
        pair(inverses, MERO_PART, HOLO_PART);
        pair(inverses, MERO_PORTION, HOLO_PORTION);
        pair(inverses, MERO_SUBSTANCE, HOLO_SUBSTANCE);
        pair(inverses, CAUSES, IS_CAUSED_BY);
        pair(inverses, ENTAILS, IS_ENTAILED_BY);
        pair(inverses, DOMAIN_TOPIC, HAS_DOMAIN_TOPIC);
        pair(inverses, DOMAIN_REGION, HAS_DOMAIN_REGION);
        pair(inverses, EXEMPLIFIES, IS_EXEMPLIFIED_BY);
        pair(inverses, STATE_OF, BE_IN_STATE);
        pair(inverses, SUBEVENT, IS_SUBEVENT_OF);
        pair(inverses, MANNER_OF, IN_MANNER);
        pair(inverses, RESTRICTS, RESTRICTED_BY);
        pair(inverses, CLASSIFIES, CLASSIFIED_BY);
        pair(inverses, ROLE, INVOLVED);
        pair(inverses, AGENT, INVOLVED_AGENT);
        pair(inverses, PATIENT, INVOLVED_PATIENT);
        pair(inverses, RESULT, INVOLVED_RESULT);
        pair(inverses, INSTRUMENT, INVOLVED_INSTRUMENT);
        pair(inverses, LOCATION, INVOLVED_LOCATION);
        pair(inverses, DIRECTION, INVOLVED_DIRECTION);
        pair(inverses, TARGET_DIRECTION, INVOLVED_TARGET_DIRECTION);
        pair(inverses, SOURCE_DIRECTION, INVOLVED_SOURCE_DIRECTION);
        pair(inverses, CO_AGENT_PATIENT, CO_PATIENT_AGENT);
        pair(inverses, CO_AGENT_INSTRUMENT, CO_INSTRUMENT_AGENT);
        pair(inverses, CO_AGENT_RESULT, CO_RESULT_AGENT);
        pair(inverses, CO_PATIENT_INSTRUMENT, CO_INSTRUMENT_PATIENT);
        pair(inverses, CO_INSTRUMENT_RESULT, CO_RESULT_INSTRUMENT);
        pair(inverses, FEMININE, HAS_FEMININE);
        pair(inverses, MASCULINE, HAS_MASCULINE);
        pair(inverses, YOUNG, HAS_YOUNG);
        pair(inverses, DIMINUTIVE, HAS_DIMINUTIVE);
        pair(inverses, AUGMENTATIVE, HAS_AUGMENTATIVE);
        pair(inverses, SIMPLE_ASPECT_IP, SIMPLE_ASPECT_PI);
        pair(inverses, SECONDARY_ASPECT_IP, SECONDARY_ASPECT_PI);
        pair(inverses, METONYM, HAS_METONYM);
        for (RelationType symmetric : new RelationType[] {
            ANTONYM, EQ_SYNONYM, SIMILAR, ALSO, ATTRIBUTE, DERIVATION,
            ANTO_GRADABLE, ANTO_SIMPLE, ANTO_CONVERSE, IR_SYNONYM, CO_ROLE,
        }) {
            inverses.put(symmetric, symmetric);
        }
        INVERSES = unmodifiableMap(inverses);
    }

    private static void pair(Map<RelationType, RelationType> inverses, RelationType a, RelationType b) {
        inverses.put(a, b);
        inverses.put(b, a);
    }

    private final String lmfName;
    private final Scope scope;

    RelationType(String lmfName, Scope scope) {
        this.lmfName = lmfName;
        this.scope = scope;
    }

    @JsonValue
    public String lmfName() {
        return lmfName;
    }

    public boolean allowedOnSynset() {
        return scope != Scope.SENSE;
    }

    public boolean allowedOnSense() {
        return scope != Scope.SYNSET;
    }

    public Optional<RelationType> inverse() {
        return Optional.ofNullable(INVERSES.get(this));
    }

    public boolean isSymmetric() {
        return INVERSES.get(this) == this;
    }

    /**
     * Resolve an LMF relation name.
     *
     * @throws IllegalArgumentException on names outside the vocabulary
     */
    @JsonCreator
    public static RelationType fromName(String name) {
        RelationType type = lookup(name);
        if (type == null) {
            throw new IllegalArgumentException("Unknown relation type: " + name);
        }
        return type;
    }

    @Nullable
    public static RelationType lookup(@Nullable String name) {
        return name == null ? null : BY_NAME.get(name);
    }
}
