// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.constrained.kernel;

import static org.objectweb.asm.Opcodes.*;

import org.objectweb.asm.AnnotationVisitor;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Type;

import uk.co.farowl.constrained.ConstrainedList;
import uk.co.farowl.constrained.Constraints;

/**
 * A class loader, child of the one that loaded the tests, in which we
 * define classes that the loader of derived classes cannot see, or
 * that name classes nobody can load.
 */
class ForeignClasses extends ClassLoader {

    /** Package of the classes defined here. */
    static final String PACKAGE = "uk.co.farowl.constrained.test.foreign";

    ForeignClasses() { super(ForeignClasses.class.getClassLoader()); }

    /**
     * Define an empty public class extending {@code Object}.
     *
     * @param simpleName of the class
     * @return the class
     */
    Class<?> plain(String simpleName) {
        ClassWriter cw = new ClassWriter(0);
        cw.visit(V17, ACC_PUBLIC | ACC_SUPER, internal(simpleName), null,
                "java/lang/Object", null);
        cw.visitEnd();
        return define(simpleName, cw.toByteArray());
    }

    /**
     * Define a class extending {@code ConstrainedList} annotated with a
     * {@link Constraints} that names a class (by its internal name)
     * that need not exist.
     *
     * @param simpleName of the class
     * @param constraint internal name of the class in the annotation
     * @return the class
     */
    Class<?> annotated(String simpleName, String constraint) {
        ClassWriter cw = containerWriter(simpleName, null);
        AnnotationVisitor av = cw.visitAnnotation(
                Type.getDescriptor(Constraints.class), true);
        AnnotationVisitor values = av.visitArray("value");
        values.visit(null, Type.getObjectType(constraint));
        values.visitEnd();
        av.visitEnd();
        cw.visitEnd();
        return define(simpleName, cw.toByteArray());
    }

    /**
     * Define a class extending {@code ConstrainedList<X>}, where
     * {@code X} is a class (by its internal name) that need not exist.
     *
     * @param simpleName of the class
     * @param argument internal name of the type argument
     * @return the class
     */
    Class<?> parameterised(String simpleName, String argument) {
        String signature = "L" + Type.getInternalName(ConstrainedList.class)
                + "<L" + argument + ";>;";
        ClassWriter cw = containerWriter(simpleName, signature);
        cw.visitEnd();
        return define(simpleName, cw.toByteArray());
    }

    /** Begin a class (without constructors) on ConstrainedList. */
    private static ClassWriter containerWriter(String simpleName,
            String signature) {
        ClassWriter cw = new ClassWriter(0);
        cw.visit(V17, ACC_PUBLIC | ACC_SUPER, internal(simpleName),
                signature, Type.getInternalName(ConstrainedList.class),
                null);
        return cw;
    }

    private static String internal(String simpleName) {
        return PACKAGE.replace('.', '/') + "/" + simpleName;
    }

    private Class<?> define(String simpleName, byte[] b) {
        return defineClass(PACKAGE + "." + simpleName, b, 0, b.length);
    }
}
