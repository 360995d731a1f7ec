package yarn.processor;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.TypeMirror;
import javax.tools.Diagnostic.Kind;

import com.google.auto.service.AutoService;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import com.squareup.javapoet.TypeVariableName;

/**
 * Generates the syntax tree visitor layer of the compiler.
 *
 * <p>Every {@link ASTNode} class gets a companion interface implementing {@code accept} and
 * {@code visitChildren} over its {@link ASTChild} accessors. In the following round {@code
 * ASTVisitor}, {@code DefaultASTVisitor} and {@code VoidDefaultASTVisitor} are written with one
 * method per node class.
 */
@AutoService(Processor.class)
public class ASTVisitorProcessor extends AbstractProcessor {

  static final String PACKAGE = "yarn.compiler";

  private static final ClassName NODE_INTERFACE = ClassName.get(PACKAGE, "ASTNodeInterface");
  private static final ClassName NODE_UTILS = ClassName.get(PACKAGE, "ASTNodeUtils");
  private static final ClassName VISITOR = ClassName.get(PACKAGE, "ASTVisitor");
  private static final ClassName DEFAULT_VISITOR = ClassName.get(PACKAGE, "DefaultASTVisitor");
  private static final ClassName VOID_VISITOR = ClassName.get(PACKAGE, "VoidDefaultASTVisitor");
  private static final TypeVariableName V = TypeVariableName.get("V");
  private static final ClassName VOID = ClassName.get(Void.class);

  // Keyed by canonical name so the generated visitors are stable between builds.
  private final Map<String, ClassName> nodeClasses = new TreeMap<>();
  private boolean visitorsWritten = false;

  @Override
  public SourceVersion getSupportedSourceVersion() {
    return SourceVersion.latestSupported();
  }

  @Override
  public ImmutableSet<String> getSupportedAnnotationTypes() {
    return ImmutableSet.of(ASTNode.class.getName(), ASTChild.class.getName());
  }

  @Override
  public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
    Set<? extends Element> nodes = roundEnv.getElementsAnnotatedWith(ASTNode.class);
    for (Element element : nodes) {
      TypeElement node = (TypeElement) element;
      writeNodeInterface(node);
      nodeClasses.put(node.getQualifiedName().toString(), ClassName.get(node));
    }

    // Written once no round adds nodes, so the visitors are still compiled with the rest.
    if (nodes.isEmpty() && !visitorsWritten && !nodeClasses.isEmpty()) {
      writeVisitors();
      visitorsWritten = true;
    }
    return true;
  }

  // Statement.Line -> Statement_Line_ASTNode
  private static String nodeInterfaceName(TypeElement node) {
    List<String> names = new ArrayList<>();
    for (Element e = node; e.getKind() != ElementKind.PACKAGE; e = e.getEnclosingElement()) {
      if (e.getKind() == ElementKind.CLASS) names.add(e.getSimpleName().toString());
    }
    return Joiner.on('_').join(Lists.reverse(names)) + "_ASTNode";
  }

  private void error(String message, Element element) {
    processingEnv.getMessager().printMessage(Kind.ERROR, message, element);
  }

  private void writeNodeInterface(TypeElement node) {
    String interfaceName = nodeInterfaceName(node);
    boolean implemented = false;
    for (TypeMirror type : node.getInterfaces()) {
      implemented |= TypeName.get(type).toString().endsWith(interfaceName);
    }
    if (!implemented) {
      error(node.getSimpleName() + " must implement " + interfaceName, node);
      return;
    }

    TypeSpec.Builder spec =
        TypeSpec.interfaceBuilder(interfaceName)
            .addModifiers(Modifier.PUBLIC)
            .addSuperinterface(NODE_INTERFACE)
            .addMethod(
                visitMethod("accept")
                    .addModifiers(Modifier.DEFAULT)
                    .addStatement("return visitor.visit(($T) this, value)", ClassName.get(node))
                    .build());

    MethodSpec.Builder visitChildren = visitMethod("visitChildren").addModifiers(Modifier.DEFAULT);
    for (Element member : node.getEnclosedElements()) {
      if (member.getKind() != ElementKind.METHOD || member.getAnnotation(ASTChild.class) == null) {
        continue;
      }
      if (member.getAnnotation(Override.class) == null) {
        error("@ASTChild methods must be marked @Override", member);
      }

      ExecutableElement child = (ExecutableElement) member;
      String name = child.getSimpleName().toString();
      spec.addMethod(
          MethodSpec.methodBuilder(name)
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(TypeName.get(child.getReturnType()))
              .build());
      visitChildren.addStatement("value = $T.accept($N(), visitor, value)", NODE_UTILS, name);
    }
    spec.addMethod(visitChildren.addStatement("return value").build());

    write(spec.addOriginatingElement(node).build(), node);
  }

  // <V> V name(ASTVisitor<V> visitor, V value)
  private static MethodSpec.Builder visitMethod(String name) {
    return MethodSpec.methodBuilder(name)
        .addAnnotation(Override.class)
        .addModifiers(Modifier.PUBLIC)
        .addTypeVariable(V)
        .returns(V)
        .addParameter(ParameterizedTypeName.get(VISITOR, V), "visitor")
        .addParameter(V, "value");
  }

  private void writeVisitors() {
    TypeSpec.Builder visitor = TypeSpec.interfaceBuilder(VISITOR).addTypeVariable(V);
    TypeSpec.Builder defaultVisitor =
        TypeSpec.classBuilder(DEFAULT_VISITOR)
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
            .addTypeVariable(V)
            .addSuperinterface(ParameterizedTypeName.get(VISITOR, V));
    TypeSpec.Builder voidVisitor =
        TypeSpec.classBuilder(VOID_VISITOR)
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
            .superclass(ParameterizedTypeName.get(DEFAULT_VISITOR, VOID));

    for (ClassName node : nodeClasses.values()) {
      visitor.addMethod(
          MethodSpec.methodBuilder("visit")
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(V)
              .addParameter(node, "node")
              .addParameter(V, "value")
              .build());
      defaultVisitor.addMethod(
          MethodSpec.methodBuilder("visit")
              .addAnnotation(Override.class)
              .addModifiers(Modifier.PUBLIC)
              .returns(V)
              .addParameter(node, "node")
              .addParameter(V, "value")
              .addStatement("return node.visitChildren(this, value)")
              .build());
      voidVisitor
          .addMethod(
              MethodSpec.methodBuilder("visit")
                  .addAnnotation(Override.class)
                  .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
                  .returns(VOID)
                  .addParameter(node, "node")
                  .addParameter(VOID, "value")
                  .addStatement("visitImpl(node)")
                  .addStatement("return null")
                  .build())
          .addMethod(
              MethodSpec.methodBuilder("visitImpl")
                  .addModifiers(Modifier.PUBLIC)
                  .addParameter(node, "node")
                  .addStatement("node.visitChildren(this, null)")
                  .build());
    }

    write(visitor.build(), null);
    write(defaultVisitor.build(), null);
    write(voidVisitor.build(), null);
  }

  private void write(TypeSpec type, Element origin) {
    try {
      JavaFile.builder(PACKAGE, type).build().writeTo(processingEnv.getFiler());
    } catch (IOException ex) {
      String message = "Cannot write " + type.name + ": " + ex;
      if (origin == null) {
        processingEnv.getMessager().printMessage(Kind.ERROR, message);
      } else {
        error(message, origin);
      }
    }
  }
}
