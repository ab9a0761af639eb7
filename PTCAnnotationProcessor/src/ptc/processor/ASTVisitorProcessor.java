package ptc.processor;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.tools.Diagnostic.Kind;
import javax.tools.FileObject;
import javax.tools.StandardLocation;

import com.google.auto.service.AutoService;
import com.google.common.collect.ImmutableSet;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import com.squareup.javapoet.TypeVariableName;

/**
 * Generates the visitor plumbing for the surface syntax tree.
 *
 * <p>For every {@link ASTNode} class {@code Outer.Name} this writes an interface {@code
 * Outer_Name_ASTNode} with default {@code accept} and {@code visitChildren} methods; the latter
 * visits every {@link ASTChild} accessor in declaration order. Once all rounds are done, the
 * {@code ASTVisitor}, {@code DefaultASTVisitor} and {@code VoidDefaultASTVisitor} types are written
 * with one method per node class.
 */
@AutoService(Processor.class)
public class ASTVisitorProcessor extends AbstractProcessor {

  private static final String PACKAGE = "ptc";
  private static final String NODE_LIST = "META-INF/astNodes/list.txt";

  private static final ClassName AST_NODE_INTERFACE_NAME =
      ClassName.get(PACKAGE, "ASTNodeInterface");
  private static final ClassName AST_VISITOR_NAME = ClassName.get(PACKAGE, "ASTVisitor");
  private static final ClassName DEFAULT_AST_VISITOR_NAME =
      ClassName.get(PACKAGE, "DefaultASTVisitor");
  private static final ClassName VOID_DEFAULT_AST_VISITOR_NAME =
      ClassName.get(PACKAGE, "VoidDefaultASTVisitor");
  private static final ClassName AST_NODE_UTILS_NAME = ClassName.get(PACKAGE, "ASTNodeUtils");
  private static final TypeVariableName V = TypeVariableName.get("V");
  private static final TypeName VOID = ClassName.get(Void.class);

  // Sorted so the generated visitors are stable across builds.
  private final Set<String> allAstNodes = new TreeSet<>();
  private boolean sawAstNodes = false;

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
    try {
      if (roundEnv.processingOver()) {
        // A compilation without any node classes (tests, for example) must not redefine the
        // visitors of the main sources.
        if (sawAstNodes) {
          generateASTVisitorFiles();
        }
      } else if (!annotations.isEmpty()) {
        processImpl(roundEnv);
      }
    } catch (IOException ex) {
      throw new RuntimeException(ex);
    }

    return true;
  }

  private void processImpl(RoundEnvironment roundEnv) throws IOException {
    for (Element element : roundEnv.getElementsAnnotatedWith(ASTNode.class)) {
      TypeElement typeElement = (TypeElement) element;
      if (!typeElement.getTypeParameters().isEmpty()) {
        processingEnv
            .getMessager()
            .printMessage(Kind.ERROR, "@ASTNode classes cannot be generic", typeElement);
        continue;
      }

      try {
        writeASTNodeFile(typeElement);
      } catch (Exception ex) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "APT Error: " + ex, typeElement);
      }

      sawAstNodes = true;
      allAstNodes.add(typeElement.getQualifiedName().toString());
    }
  }

  // Merges the node classes of previous incremental compilations with the ones seen now.
  private void syncNodeList() throws IOException {
    FileObject file = null;
    try {
      file = processingEnv.getFiler().getResource(StandardLocation.CLASS_OUTPUT, "", NODE_LIST);
      try (BufferedReader br =
          new BufferedReader(
              new InputStreamReader(file.openInputStream(), StandardCharsets.UTF_8))) {
        String line;
        while ((line = br.readLine()) != null) {
          line = line.trim();
          if (!line.isEmpty()) {
            allAstNodes.add(line);
          }
        }
      }
    } catch (IOException notYetWritten) {
      file = processingEnv.getFiler().createResource(StandardLocation.CLASS_OUTPUT, "", NODE_LIST);
    }

    try (Writer wr = file.openWriter()) {
      wr.append(allAstNodes.stream().collect(Collectors.joining("\n", "", "\n")));
    }
  }

  private void generateASTVisitorFiles() throws IOException {
    syncNodeList();

    writeVisitorType(
        TypeSpec.interfaceBuilder(AST_VISITOR_NAME)
            .addModifiers(Modifier.PUBLIC)
            .addTypeVariable(V),
        node ->
            MethodSpec.methodBuilder("visit")
                .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
                .returns(V)
                .addParameter(node, "node")
                .addParameter(V, "value")
                .build());

    writeVisitorType(
        TypeSpec.classBuilder(DEFAULT_AST_VISITOR_NAME)
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
            .addTypeVariable(V)
            .addSuperinterface(ParameterizedTypeName.get(AST_VISITOR_NAME, V)),
        node ->
            MethodSpec.methodBuilder("visit")
                .addAnnotation(Override.class)
                .addModifiers(Modifier.PUBLIC)
                .returns(V)
                .addParameter(node, "node")
                .addParameter(V, "value")
                .addStatement("return node.visitChildren(this, value)")
                .build());

    TypeSpec.Builder voidVisitor =
        TypeSpec.classBuilder(VOID_DEFAULT_AST_VISITOR_NAME)
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
            .superclass(ParameterizedTypeName.get(DEFAULT_AST_VISITOR_NAME, VOID));
    for (String node : allAstNodes) {
      ClassName nodeName = ClassName.bestGuess(node);
      voidVisitor.addMethod(
          MethodSpec.methodBuilder("visit")
              .addAnnotation(Override.class)
              .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
              .returns(VOID)
              .addParameter(nodeName, "node")
              .addParameter(VOID, "value")
              .addStatement("visitImpl(node)")
              .addStatement("return null")
              .build());
      voidVisitor.addMethod(
          MethodSpec.methodBuilder("visitImpl")
              .addModifiers(Modifier.PUBLIC)
              .addParameter(nodeName, "node")
              .addStatement("node.visitChildren(this, null)")
              .build());
    }
    writeJavaFile(voidVisitor.build());
  }

  private void writeVisitorType(TypeSpec.Builder builder, Function<ClassName, MethodSpec> method)
      throws IOException {
    for (String node : allAstNodes) {
      builder.addMethod(method.apply(ClassName.bestGuess(node)));
    }
    writeJavaFile(builder.build());
  }

  private void writeJavaFile(TypeSpec typeSpec) throws IOException {
    JavaFile.builder(PACKAGE, typeSpec)
        .skipJavaLangImports(true)
        .build()
        .writeTo(processingEnv.getFiler());
  }

  private static String getASTNodeClassName(Element element) {
    Deque<String> elems = new ArrayDeque<>();
    elems.push("ASTNode");
    do {
      if (element.getKind() == ElementKind.CLASS) {
        elems.addFirst(element.getSimpleName().toString());
      }
      element = element.getEnclosingElement();
    } while (element.getKind() != ElementKind.PACKAGE);
    return String.join("_", elems);
  }

  private void writeASTNodeFile(TypeElement element) throws IOException {
    String interfaceName = getASTNodeClassName(element);
    if (element
        .getInterfaces()
        .stream()
        .noneMatch(i -> TypeName.get(i).toString().endsWith(interfaceName))) {
      processingEnv
          .getMessager()
          .printMessage(Kind.ERROR, "Missing interface: " + interfaceName, element);
      return;
    }

    ClassName nodeName = ClassName.get(element);
    ParameterSpec visitor =
        ParameterSpec.builder(ParameterizedTypeName.get(AST_VISITOR_NAME, V), "visitor").build();
    ParameterSpec value = ParameterSpec.builder(V, "value").build();

    TypeSpec.Builder typeSpecBuilder =
        TypeSpec.interfaceBuilder(interfaceName)
            .addModifiers(Modifier.PUBLIC)
            .addSuperinterface(AST_NODE_INTERFACE_NAME);

    typeSpecBuilder.addMethod(
        MethodSpec.methodBuilder("accept")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(visitor)
            .addParameter(value)
            .addStatement("return visitor.visit(($T) this, value)", nodeName)
            .build());

    MethodSpec.Builder visitChildrenMethodBuilder =
        MethodSpec.methodBuilder("visitChildren")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(visitor)
            .addParameter(value);
    for (Element maybeMethod : element.getEnclosedElements()) {
      if (maybeMethod.getKind() != ElementKind.METHOD) continue;
      if (maybeMethod.getAnnotation(ASTChild.class) == null) continue;
      if (maybeMethod.getAnnotation(Override.class) == null) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "Missing @Override", maybeMethod);
      }

      ExecutableElement method = (ExecutableElement) maybeMethod;
      typeSpecBuilder.addMethod(
          MethodSpec.methodBuilder(method.getSimpleName().toString())
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(TypeName.get(method.getReturnType()))
              .build());

      visitChildrenMethodBuilder.addStatement(
          "value = $T.accept($L(), visitor, value)",
          AST_NODE_UTILS_NAME,
          method.getSimpleName().toString());
    }
    typeSpecBuilder.addMethod(visitChildrenMethodBuilder.addStatement("return value").build());

    writeJavaFile(typeSpecBuilder.build());
  }
}
