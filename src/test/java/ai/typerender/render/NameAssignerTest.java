package ai.typerender.render;

import ai.typerender.model.ArrayType;
import ai.typerender.model.ClassProperty;
import ai.typerender.model.ClassType;
import ai.typerender.model.EnumType;
import ai.typerender.model.PrimitiveType;
import ai.typerender.model.Type;
import ai.typerender.model.TypeGraph;
import ai.typerender.model.UnionType;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NameAssignerTest {

    private final NameAssigner assigner = new NameAssigner(RenderOptions.defaults());

    @Test
    void topLevelLabelNamesItsClass() {
        ClassType person = new ClassType("individual");
        NameTable names = assigner.assign(TypeGraph.of("person", person));
        assertEquals("Person", names.nameFor(person));
        assertTrue(names.topLevelAliases().isEmpty());
    }

    @Test
    void otherTopLevelsBecomeAliases() {
        ClassType person = new ClassType("person");
        Map<String, Type> topLevels = new LinkedHashMap<>();
        topLevels.put("people", new ArrayType(person));
        topLevels.put("also_person", person);
        topLevels.put("same_person", person);

        NameTable names = assigner.assign(new TypeGraph(topLevels));

        assertEquals("AlsoPerson", names.nameFor(person));
        assertEquals(Map.of("people", "People", "same_person", "SamePerson"), names.topLevelAliases());
    }

    @Test
    void separatesEqualLabels() {
        ClassType first = new ClassType("item");
        ClassType second = new ClassType("item");
        ClassType holder = new ClassType("holder", Map.of(
            "first", ClassProperty.required(first),
            "second", ClassProperty.required(new ArrayType(second))));

        NameTable names = assigner.assign(TypeGraph.of("holder", holder));

        assertNotEquals(names.nameFor(first), names.nameFor(second));
        assertTrue(List.of("Item", "Item1").contains(names.nameFor(first)));
        assertTrue(List.of("Item", "Item1").contains(names.nameFor(second)));
    }

    @Test
    void avoidsReservedAndImportedNames() {
        ClassType list = new ClassType("list");
        Map<String, ClassProperty> properties = new LinkedHashMap<>();
        properties.put("type", ClassProperty.required(PrimitiveType.STRING));
        properties.put("self", ClassProperty.required(PrimitiveType.STRING));
        properties.put("class", ClassProperty.required(PrimitiveType.STRING));
        properties.put("date", ClassProperty.required(PrimitiveType.DATE));
        properties.put("items", ClassProperty.required(list));
        ClassType holder = new ClassType("holder", properties);

        NameTable names = assigner.assign(TypeGraph.of("holder", holder));

        assertEquals("List1", names.nameFor(list));
        assertEquals(List.of("type1", "self1", "class1", "date1", "items"),
            List.copyOf(names.propertyNames(holder).values()));
    }

    @Test
    void enumCasesAreScopedPerEnum() {
        EnumType color = new EnumType("color", List.of("red", "RED", "dark-blue"));
        EnumType mood = new EnumType("mood", List.of("red"));
        ClassType holder = new ClassType("holder", Map.of(
            "color", ClassProperty.required(color),
            "mood", ClassProperty.required(mood)));

        NameTable names = assigner.assign(TypeGraph.of("holder", holder));

        assertEquals(List.of("Red", "RED", "DarkBlue"), names.caseNames(color));
        assertEquals(List.of("Red"), names.caseNames(mood));
    }

    @Test
    void unionsAreNamedOnlyWhenDeclared() {
        UnionType value = new UnionType("value", List.of(PrimitiveType.STRING, PrimitiveType.INTEGER));
        UnionType nullable = new UnionType("maybe", List.of(PrimitiveType.STRING, PrimitiveType.NULL));
        ClassType holder = new ClassType("holder", Map.of(
            "value", ClassProperty.required(value),
            "maybe", ClassProperty.required(nullable)));
        TypeGraph graph = TypeGraph.of("holder", holder);

        NameTable inline = assigner.assign(graph);
        assertFalse(inline.hasName(value));

        NameTable declared = new NameAssigner(RenderOptions.defaults().withDeclareUnions(true)).assign(graph);
        assertEquals("Value", declared.nameFor(value));
        assertFalse(declared.hasName(nullable));
    }

    @Test
    void reportsAssignedNames() {
        EnumType color = new EnumType("color", List.of("red"));
        ClassType shape = new ClassType("shape", Map.of("color", ClassProperty.required(color)));

        Map<String, Object> report = assigner.assign(TypeGraph.of("shape", shape)).report();

        @SuppressWarnings("unchecked")
        Map<String, Object> types = (Map<String, Object>) report.get("types");
        assertEquals(List.of("Shape", "Color"), List.copyOf(types.keySet()));
        assertEquals(Map.of("label", "color", "kind", "enum", "cases", List.of("Red")), types.get("Color"));
    }
}
