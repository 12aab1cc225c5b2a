// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.constrained.kernel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import uk.co.farowl.constrained.AllowedTypes;
import uk.co.farowl.constrained.ConstrainedList;
import uk.co.farowl.constrained.ConstrainedTypes;
import uk.co.farowl.constrained.Constraints;
import uk.co.farowl.constrained.ConstructionViolation;
import uk.co.farowl.constrained.DerivationSpec;
import uk.co.farowl.constrained.ElementTypeViolation;
import uk.co.farowl.constrained.support.DerivationError;

/**
 * Tests of {@link ContainerFactory}, mostly with a private factory so
 * that class names are predictable.
 */
@DisplayName("ContainerFactory")
class ContainerFactoryTest {

    static final String PACKAGE = "uk.co.farowl.constrained.test.derived";

    ContainerFactory factory;

    @BeforeEach
    void setup() { factory = new ContainerFactory(PACKAGE, "%s$%d", null); }

    /** A container class with no public constructor. */
    static class Hidden extends ConstrainedList<String> {
        Hidden(Iterable<String> initial, AllowedTypes constraints) {
            super(initial, constraints);
        }
    }

    @Nested
    @DisplayName("derives a class")
    class Derive {

        @Test
        void withConstraints() {
            Class<? extends ConstrainedList<?>> c = factory.findOrCreate(
                    new DerivationSpec("Words").constraints(String.class,
                            Character.class));
            assertEquals(PACKAGE + ".Words$1", c.getName());
            assertSame(ConstrainedList.class, c.getSuperclass());
            assertTrue(Modifier.isPublic(c.getModifiers()));
            assertSame(factory.loader, c.getClassLoader());

            Constraints a = c.getAnnotation(Constraints.class);
            assertEquals(List.of(String.class, Character.class),
                    List.of(a.value()));
            assertEquals(AllowedTypes.of(String.class, Character.class),
                    ConstrainedTypes.declaredTypes(c));
        }

        @Test
        void withTypeParameter() {
            Class<? extends ConstrainedList<?>> c = factory.findOrCreate(
                    new DerivationSpec("Counts").typeParameter(int.class));
            assertNull(c.getAnnotation(Constraints.class));
            Type s = c.getGenericSuperclass();
            assertTrue(s instanceof ParameterizedType);
            assertEquals(Integer.class,
                    ((ParameterizedType)s).getActualTypeArguments()[0]);
            assertEquals(AllowedTypes.of(Integer.class),
                    ConstrainedTypes.declaredTypes(c));
        }

        /** The annotation takes precedence, as in source. */
        @Test
        void withBoth() {
            Class<? extends ConstrainedList<?>> c = factory.findOrCreate(
                    new DerivationSpec("Both").typeParameter(Number.class)
                            .constraints(Long.class));
            assertEquals(AllowedTypes.of(Long.class),
                    ConstrainedTypes.declaredTypes(c));
        }

        @Test
        void withNeither() {
            Class<? extends ConstrainedList<?>> c =
                    factory.findOrCreate(new DerivationSpec("Any"));
            assertSame(AllowedTypes.OPEN,
                    ConstrainedTypes.declaredTypes(c));
        }

        @Test
        void withPublicConstructors() throws NoSuchMethodException {
            Class<? extends ConstrainedList<?>> c =
                    factory.findOrCreate(new DerivationSpec("Cons"));
            assertTrue(Modifier.isPublic(
                    c.getConstructor(Iterable.class).getModifiers()));
            c.getConstructor(Iterable.class, AllowedTypes.class);
            c.getConstructor(Iterable.class, AllowedTypes.class,
                    int.class);
        }
    }

    @Nested
    @DisplayName("names and caches classes")
    class Cache {

        @Test
        void sameSpecSameClass() {
            DerivationSpec s1 =
                    new DerivationSpec("Cached").constraints(Byte.class);
            DerivationSpec s2 =
                    new DerivationSpec("Cached").constraints(Byte.class);
            assertNotSame(s1, s2);
            assertSame(factory.findOrCreate(s1), factory.findOrCreate(s2));
        }

        @Test
        void sameNameDifferentClass() {
            Class<?> c1 = factory.findOrCreate(
                    new DerivationSpec("Thing").constraints(Byte.class));
            Class<?> c2 = factory.findOrCreate(
                    new DerivationSpec("Thing").constraints(Short.class));
            assertNotSame(c1, c2);
            assertEquals(PACKAGE + ".Thing$1", c1.getName());
            assertEquals(PACKAGE + ".Thing$2", c2.getName());
        }

        @Test
        void uniqueNames() {
            assertEquals("A$1", factory.uniqueName("A"));
            assertEquals("B$1", factory.uniqueName("B"));
            assertEquals("A$2", factory.uniqueName("A"));
        }

        @Test
        void specFrozen() {
            DerivationSpec spec = new DerivationSpec("Frozen");
            assertFalse(spec.isFrozen());
            factory.findOrCreate(spec);
            assertTrue(spec.isFrozen());
            assertThrows(IllegalStateException.class,
                    () -> spec.constraints(String.class));
            assertThrows(IllegalStateException.class,
                    () -> spec.typeParameter(String.class));
        }

        /** Each factory has its own loader, hence its own classes. */
        @Test
        void separateFactories() {
            ContainerFactory other =
                    new ContainerFactory(PACKAGE, "%s$%d", null);
            Class<?> c1 = factory.findOrCreate(new DerivationSpec("Twin"));
            Class<?> c2 = other.findOrCreate(new DerivationSpec("Twin"));
            assertEquals(c1.getName(), c2.getName());
            assertNotSame(c1, c2);
        }
    }

    @Nested
    @DisplayName("makes classes that")
    class Instances {

        Class<? extends ConstrainedList<?>> words;

        @BeforeEach
        void derive() {
            words = factory.findOrCreate(
                    new DerivationSpec("Words").constraints(String.class));
        }

        @Test
        void construct() {
            ConstrainedList<?> w =
                    ConstrainedTypes.newInstance(words, List.of("a", "b"));
            assertSame(words, w.getClass());
            assertEquals(AllowedTypes.of(String.class), w.allowedTypes());
            w.append("c");
            assertEquals(List.of("a", "b", "c"), w);
            assertThrows(ElementTypeViolation.class, () -> w.append(1));
        }

        @Test
        void constructExplicit() {
            ConstrainedList<?> w = ConstrainedTypes.newInstance(words,
                    List.of(1), AllowedTypes.of(Integer.class));
            assertEquals(AllowedTypes.of(Integer.class), w.allowedTypes());
        }

        @Test
        void refuseInitialElements() {
            ConstructionViolation cv =
                    assertThrows(ConstructionViolation.class,
                            () -> ConstrainedTypes.newInstance(words,
                                    List.of("a", 2)));
            assertSame(words, cv.containerType());
            assertEquals(List.of(1), cv.getCause().offendingIndices());
        }

        @Test
        void needPublicConstructor() {
            DerivationError e = assertThrows(DerivationError.class,
                    () -> ConstrainedTypes.newInstance(Hidden.class,
                            List.of("a")));
            assertTrue(e.getMessage().contains(Hidden.class.getName()));
        }
    }

    @Nested
    @DisplayName("refuses classes it cannot see")
    class Visibility {

        /** Defined in a loader below the one of derived classes. */
        Class<?> foreign;

        @BeforeEach
        void define() { foreign = new ForeignClasses().plain("Foreign"); }

        @Test
        void inConstraints() {
            DerivationError e = assertThrows(DerivationError.class,
                    () -> factory.findOrCreate(new DerivationSpec("ForeignC")
                            .constraints(foreign)));
            assertTrue(e.getMessage().contains(foreign.getName()));
        }

        @Test
        void inMixedConstraints() {
            assertThrows(DerivationError.class,
                    () -> factory.findOrCreate(new DerivationSpec("ForeignM")
                            .constraints(String.class, foreign)));
        }

        @Test
        void asTypeParameter() {
            assertThrows(DerivationError.class,
                    () -> factory.findOrCreate(new DerivationSpec("ForeignT")
                            .typeParameter(foreign)));
        }

        @Test
        void asArrayComponent() {
            assertThrows(DerivationError.class,
                    () -> factory.findOrCreate(new DerivationSpec("ForeignA")
                            .constraints(foreign.arrayType())));
        }

        /** Nothing is cached by a refusal. */
        @Test
        void noClassLeftBehind() {
            DerivationSpec spec =
                    new DerivationSpec("Retry").constraints(foreign);
            assertThrows(DerivationError.class,
                    () -> factory.findOrCreate(spec));
            assertThrows(DerivationError.class,
                    () -> factory.findOrCreate(spec));
        }

        /** Classes from the loader of the library itself are fine. */
        @Test
        void visibleClasses() {
            Class<? extends ConstrainedList<?>> c = factory.findOrCreate(
                    new DerivationSpec("Visible")
                            .constraints(ContainerFactoryTest.class,
                                    int[].class, String[][].class)
                            .typeParameter(Hidden.class));
            assertEquals(AllowedTypes.of(ContainerFactoryTest.class,
                    int[].class, String[][].class),
                    ConstrainedTypes.declaredTypes(c));
        }
    }

    @Test
    @DisplayName("writes class files when asked")
    void dump(@TempDir Path dir) {
        Path out = dir.resolve("classes");
        ContainerFactory f = new ContainerFactory(PACKAGE, "%s$%d", out);
        f.findOrCreate(new DerivationSpec("Dumped").constraints(Long.class));
        assertTrue(Files.isRegularFile(out.resolve("Dumped$1.class")));
    }

    @Test
    @DisplayName("derives through ConstrainedTypes")
    void globalFactory() {
        DerivationSpec spec =
                new DerivationSpec("GlobalDoubles").constraints(Double.class);
        Class<? extends ConstrainedList<?>> c = ConstrainedTypes.derive(spec);
        assertTrue(c.getName().startsWith(ConstrainedTypes.DEFAULT_PACKAGE
                + ".GlobalDoubles$"));
        assertSame(c, ConstrainedTypes.derive(
                new DerivationSpec("GlobalDoubles").constraints(Double.class)));
        ConstrainedList<?> d = ConstrainedTypes.newInstance(c, List.of(1.5));
        assertEquals(AllowedTypes.of(Double.class), d.allowedTypes());
        assertTrue(ConstrainedTypes.isCompatible(c));
    }

    @Test
    @DisplayName("requires a valid name")
    void invalidNames() {
        assertThrows(IllegalArgumentException.class,
                () -> new DerivationSpec("not valid"));
        assertThrows(IllegalArgumentException.class,
                () -> new DerivationSpec("1st"));
        assertThrows(IllegalArgumentException.class,
                () -> new DerivationSpec(""));
        assertThrows(IllegalArgumentException.class,
                () -> new DerivationSpec("Good").constraints(
                        AllowedTypes.OPEN));
    }
}
