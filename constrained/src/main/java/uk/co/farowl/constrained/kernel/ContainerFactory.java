// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.constrained.kernel;

import static org.objectweb.asm.Opcodes.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.objectweb.asm.AnnotationVisitor;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.AnnotationNode;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.InsnList;
import org.objectweb.asm.tree.InsnNode;
import org.objectweb.asm.tree.MethodInsnNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.VarInsnNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.constrained.AllowedTypes;
import uk.co.farowl.constrained.ConstrainedList;
import uk.co.farowl.constrained.Constraints;
import uk.co.farowl.constrained.DerivationSpec;
import uk.co.farowl.constrained.support.DerivationError;

/**
 * A factory for container classes derived from {@link ConstrainedList}
 * at run time, according to a {@link DerivationSpec}. Each class we
 * synthesise is the equivalent of a source declaration:<pre>
 * &#064;Constraints({...})    // if the spec has constraints
 * public class Name$1 extends ConstrainedList&lt;P&gt; {
 *     public Name$1(Iterable initial) { super(initial); }
 *     public Name$1(Iterable initial, AllowedTypes c) {
 *         super(initial, c);
 *     }
 *     public Name$1(Iterable initial, AllowedTypes c, int n) {
 *         super(initial, c, n);
 *     }
 * }
 * </pre>so that the class-level constraints are found by
 * {@link ClassConstraints} in exactly the way they are for a class
 * written in Java.
 */
public class ContainerFactory {

    /** Logger for the container factory. */
    final Logger logger = LoggerFactory.getLogger(ContainerFactory.class);

    /** A prefix used in {@link ContainerBuilder#begin()}. */
    private final String packagePart;
    /** A name template used in {@link #uniqueName(String)}. */
    private final String nameTemplate;
    /** Where to write class files, or {@code null} not to. */
    private final Path dumpDirectory;

    /**
     * The classes created in this factory by spec. We do not use a weak
     * reference here because the loader (which is part of class
     * identity) keeps the classes alive anyway.
     */
    private final Map<DerivationSpec, Class<?>> derived;

    /**
     * We name each class we synthesise after the name in the spec, with
     * a one-up number. This table must only be accessed when holding a
     * lock on this instance of {@code ContainerFactory}.
     */
    private final Map<String, AtomicInteger> unique = new HashMap<>();

    /** {@code ClassLoader} for the derived classes. */
    static class DerivedLoader extends ClassLoader {

        DerivedLoader(ClassLoader parent) { super(parent); }

        Class<?> defineClass(byte[] b) {
            return defineClass(null, b, 0, b.length);
        }
    }

    /** {@code ClassLoader} for the derived classes. */
    final DerivedLoader loader;

    /**
     * Create a factory with specific package (a dotted string like
     * {@code "uk.co.farowl.constrained.derived"}) and a string format
     * for generating class names, requiring one string and one integer
     * (like {@code "%s$%d"}).
     *
     * @param derivedPackage dotted package name
     * @param nameTemplate format of class names
     * @param dumpDirectory where to write class files or {@code null}
     */
    public ContainerFactory(String derivedPackage, String nameTemplate,
            Path dumpDirectory) {
        // Convert package name for ASM: uk/co/farowl/constrained/derived/
        this.packagePart = derivedPackage.replace('.', '/') + "/";
        this.nameTemplate = nameTemplate;
        this.dumpDirectory = dumpDirectory;
        this.derived = new HashMap<>();
        this.loader =
                new DerivedLoader(ConstrainedList.class.getClassLoader());
        logger.atInfo().setMessage("Container factory created for {}")
                .addArgument(derivedPackage).log();
    }

    /**
     * Find a class (created by a previous call), or create a class now,
     * that matches the specification. The specification is frozen by
     * this call.
     *
     * @param spec of the required class
     * @return the derived class
     * @throws DerivationError if a class named in the spec is not
     *     visible to the loader of derived classes, or the class cannot
     *     be defined
     */
    @SuppressWarnings("unchecked")
    public synchronized Class<? extends ConstrainedList<?>>
            findOrCreate(DerivationSpec spec) {
        spec.freeze();
        Class<?> c = derived.get(spec);
        if (c == null) {
            // Classes named in the spec must resolve from our loader
            for (Class<?> k : spec.getConstraints().toSet()) {
                checkVisible(k, spec);
            }
            Class<?> p = spec.getTypeParameter();
            if (p != null) { checkVisible(p, spec); }

            // Make a class
            ContainerBuilder cb = new ContainerBuilder(spec);
            cb.build();
            byte[] b = cb.toByteArray();

            if (dumpDirectory != null) {
                // Write so we can dump it later.
                Path classFile = dumpDirectory.resolve(cb.simpleName + ".class");
                try {
                    Files.createDirectories(dumpDirectory);
                    Files.write(classFile, b);
                } catch (IOException e) {
                    throw new DerivationError(e, "writing class file %s",
                            classFile);
                }
            }

            // Create (and cache) the class
            try {
                c = loader.defineClass(b);
            } catch (LinkageError e) {
                throw new DerivationError(e, "defining class for %s",
                        spec);
            }
            derived.put(spec, c);
            logger.atDebug().setMessage("Derived {} for {}")
                    .addArgument(c::getName).addArgument(spec).log();
        }
        return (Class<? extends ConstrainedList<?>>)c;
    }

    /**
     * Check that a class named in a specification is the one our loader
     * finds by that name. The derived class refers to it only by name,
     * so a class defined by a loader we cannot see (a child of ours,
     * say) would fail to resolve each time the derived class is used.
     *
     * @param c named in the spec
     * @param spec in which it is named
     * @throws DerivationError if {@code c} is not visible
     */
    private void checkVisible(Class<?> c, DerivationSpec spec)
            throws DerivationError {
        Class<?> e = c;
        while (e.isArray()) { e = e.getComponentType(); }
        if (e.isPrimitive()) { return; }
        Class<?> found;
        try {
            found = Class.forName(e.getName(), false, loader);
        } catch (ClassNotFoundException | LinkageError le) {
            throw new DerivationError(le,
                    "%s in %s is not visible to derived classes",
                    e.getName(), spec);
        }
        if (found != e) {
            throw new DerivationError(
                    "%s in %s is not the class of that name visible"
                            + " to derived classes",
                    e.getName(), spec);
        }
    }

    /**
     * We name each class we synthesise after the name in the spec, with
     * a one-up number.
     */
    synchronized String uniqueName(String baseName) {
        AtomicInteger id =
                unique.computeIfAbsent(baseName, k -> new AtomicInteger());
        int n = id.incrementAndGet();
        return String.format(nameTemplate, baseName, n);
    }

    /**
     * Descriptor of a constructor of {@code ConstrainedList} in
     * internal format.
     *
     * @param args types of arguments
     * @return descriptor
     */
    private static String superConstructor(Class<?>... args) {
        try {
            return Type.getConstructorDescriptor(
                    ConstrainedList.class.getDeclaredConstructor(args));
        } catch (NoSuchMethodException | SecurityException e) {
            // Should never happen.
            throw new DerivationError(e, "reflecting %s constructor",
                    ConstrainedList.class.getSimpleName());
        }
    }

    /** The constructor taking initial contents only. */
    private static final String INIT_1 = superConstructor(Iterable.class);
    /** The constructor adding explicit constraints. */
    private static final String INIT_2 =
            superConstructor(Iterable.class, AllowedTypes.class);
    /** The constructor adding initial capacity. */
    private static final String INIT_3 = superConstructor(Iterable.class,
            AllowedTypes.class, int.class);

    /** A builder object for one class from a given specification. */
    class ContainerBuilder {

        final DerivationSpec spec;
        final String simpleName;
        private final ClassNode cn;

        /**
         * Create builder from specification.
         *
         * @param spec to follow
         */
        ContainerBuilder(DerivationSpec spec) {
            this.cn = new ClassNode();
            this.spec = spec;
            // Get a new unique class name according to factory + spec
            this.simpleName = uniqueName(spec.getName());
            logger.atDebug().setMessage("Creating class {} for spec {}")
                    .addArgument(simpleName).addArgument(spec).log();
        }

        /** Build the internal representation of the class specified. */
        void build() {
            begin();
            addConstraints();
            addConstructor(INIT_1, 1);
            addConstructor(INIT_2, 2);
            addConstructor(INIT_3, 3);
        }

        /**
         * Get the class definition as a JVM byte code file.
         *
         * @return the class definition
         */
        byte[] toByteArray() {
            ClassWriter cw = new ClassWriter(ClassWriter.COMPUTE_MAXS
                    | ClassWriter.COMPUTE_FRAMES);
            cn.accept(cw);
            return cw.toByteArray();
        }

        /**
         * Begin the class definition with a version, a name and
         * {@code ConstrainedList} as the superclass. If the spec names
         * a type parameter, we give the class a generic signature that
         * binds it.
         */
        void begin() {
            cn.version = V17;
            cn.access = ACC_PUBLIC | ACC_SUPER;
            cn.name = packagePart + simpleName;
            cn.superName = Type.getInternalName(ConstrainedList.class);
            Class<?> p = spec.getTypeParameter();
            if (p != null) {
                cn.signature = "L" + cn.superName + "<"
                        + Type.getDescriptor(p) + ">;";
            }
        }

        /** Add the {@link Constraints} annotation if the spec has any. */
        void addConstraints() {
            AllowedTypes constraints = spec.getConstraints();
            if (!constraints.isEmpty()) {
                AnnotationNode an = new AnnotationNode(
                        Type.getDescriptor(Constraints.class));
                AnnotationVisitor av = an.visitArray("value");
                for (Class<?> c : constraints.toSet()) {
                    av.visit(null, Type.getType(c));
                }
                av.visitEnd();
                List<AnnotationNode> annotations = new ArrayList<>();
                annotations.add(an);
                cn.visibleAnnotations = annotations;
            }
        }

        /**
         * Add a public constructor that passes all its arguments to the
         * constructor of {@code ConstrainedList} with the same
         * descriptor.
         *
         * @param descr of the constructor (and its super)
         * @param nargs number of arguments (the last may be an int)
         */
        void addConstructor(String descr, int nargs) {
            MethodNode mn =
                    new MethodNode(ACC_PUBLIC, "<init>", descr, null, null);
            InsnList ins = mn.instructions;
            ins.add(new VarInsnNode(ALOAD, 0));
            for (int i = 1; i <= nargs; i++) {
                // Only the capacity (third argument) is an int
                ins.add(new VarInsnNode(i == 3 ? ILOAD : ALOAD, i));
            }
            ins.add(new MethodInsnNode(INVOKESPECIAL, cn.superName,
                    "<init>", descr, false));
            ins.add(new InsnNode(RETURN));
            cn.methods.add(mn);
        }
    }
}
