package org.example.sysmlapi.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The displayable element types and their SysML v2 textual keywords.
 *
 * A type tag that is not listed here is not displayable: it is kept in the
 * cache but dropped from trees, and the text generator renders it only as a
 * comment placeholder. Supporting a new type means adding a constant.
 */
public enum ElementType {
    PACKAGE("Package", "package"),
    NAMESPACE("Namespace", "namespace"),

    PART_DEFINITION("PartDefinition", "part def"),
    PART_USAGE("PartUsage", "part"),
    ATTRIBUTE_DEFINITION("AttributeDefinition", "attribute def"),
    ATTRIBUTE_USAGE("AttributeUsage", "attribute"),
    ITEM_DEFINITION("ItemDefinition", "item def"),
    ITEM_USAGE("ItemUsage", "item"),
    PORT_DEFINITION("PortDefinition", "port def"),
    PORT_USAGE("PortUsage", "port"),
    INTERFACE_DEFINITION("InterfaceDefinition", "interface def"),
    INTERFACE_USAGE("InterfaceUsage", "interface"),
    CONNECTION_DEFINITION("ConnectionDefinition", "connection def"),
    CONNECTION_USAGE("ConnectionUsage", "connection"),
    FLOW_CONNECTION_USAGE("FlowConnectionUsage", "flow"),
    ACTION_DEFINITION("ActionDefinition", "action def"),
    ACTION_USAGE("ActionUsage", "action"),
    STATE_DEFINITION("StateDefinition", "state def"),
    STATE_USAGE("StateUsage", "state"),
    REQUIREMENT_DEFINITION("RequirementDefinition", "requirement def"),
    REQUIREMENT_USAGE("RequirementUsage", "requirement"),
    CONSTRAINT_DEFINITION("ConstraintDefinition", "constraint def"),
    CONSTRAINT_USAGE("ConstraintUsage", "constraint"),
    CONCERN_DEFINITION("ConcernDefinition", "concern def"),
    CONCERN_USAGE("ConcernUsage", "concern"),
    VIEW_DEFINITION("ViewDefinition", "view def"),
    VIEW_USAGE("ViewUsage", "view"),
    VIEWPOINT_DEFINITION("ViewpointDefinition", "viewpoint def"),
    VIEWPOINT_USAGE("ViewpointUsage", "viewpoint"),
    RENDERING_DEFINITION("RenderingDefinition", "rendering def"),
    RENDERING_USAGE("RenderingUsage", "rendering"),
    ENUMERATION_DEFINITION("EnumerationDefinition", "enum def"),
    ENUMERATION_USAGE("EnumerationUsage", "enum"),
    OCCURRENCE_DEFINITION("OccurrenceDefinition", "occurrence def"),
    OCCURRENCE_USAGE("OccurrenceUsage", "occurrence"),
    ALLOCATION_DEFINITION("AllocationDefinition", "allocation def"),
    ALLOCATION_USAGE("AllocationUsage", "allocate"),
    ANALYSIS_CASE_DEFINITION("AnalysisCaseDefinition", "analysis def"),
    ANALYSIS_CASE_USAGE("AnalysisCaseUsage", "analysis"),
    CALCULATION_DEFINITION("CalculationDefinition", "calc def"),
    CALCULATION_USAGE("CalculationUsage", "calc"),
    CASE_DEFINITION("CaseDefinition", "case def"),
    CASE_USAGE("CaseUsage", "case"),
    METADATA_DEFINITION("MetadataDefinition", "metadata def"),
    METADATA_USAGE("MetadataUsage", "metadata"),

    COMMENT("Comment", "comment"),
    DOCUMENTATION("Documentation", "doc");

    private static final Map<String, ElementType> BY_TAG = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(ElementType::tag, Function.identity()));

    private final String tag;
    private final String keyword;

    ElementType(String tag, String keyword) {
        this.tag = tag;
        this.keyword = keyword;
    }

    public String tag() {
        return tag;
    }

    public String keyword() {
        return keyword;
    }

    /** Looks up a type tag; dotted tags ({@code sysml.PartUsage}) match on their last segment. */
    public static Optional<ElementType> fromTag(String tag) {
        if (tag == null) return Optional.empty();
        int dot = tag.lastIndexOf('.');
        return Optional.ofNullable(BY_TAG.get(dot >= 0 ? tag.substring(dot + 1) : tag));
    }

    public static Optional<ElementType> of(Element element) {
        return fromTag(element.type());
    }

    public static boolean isDisplayable(String tag) {
        return fromTag(tag).isPresent();
    }

    public static boolean isDisplayable(Element element) {
        return isDisplayable(element.type());
    }
}
