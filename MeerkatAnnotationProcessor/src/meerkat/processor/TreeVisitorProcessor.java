package meerkat.processor;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;
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
import javax.tools.JavaFileObject;
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

/** Generates {@code *_TreeNode} interfaces and the visitors for {@link TreeNode} classes. */
@AutoService(Processor.class)
public class TreeVisitorProcessor extends AbstractProcessor {

  private static final String NODE_LIST_DIR = "META-INF/treeNodes/";
  private static final TypeVariableName V = TypeVariableName.get("V");

  private final Set<String> allTreeNodes = new HashSet<>();
  private String treePackage = null;

  @Override
  public SourceVersion getSupportedSourceVersion() {
    return SourceVersion.latestSupported();
  }

  @Override
  public ImmutableSet<String> getSupportedAnnotationTypes() {
    return ImmutableSet.of(TreeNode.class.getName(), TreeChild.class.getName());
  }

  @Override
  public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
    try {
      if (roundEnv.processingOver()) {
        if (treePackage != null) generateVisitorFiles();
      } else if (!annotations.isEmpty()) {
        processImpl(roundEnv);
      }
    } catch (IOException ex) {
      throw new RuntimeException(ex);
    }

    return true;
  }

  // Incremental builds only see the changed nodes, so the full list is kept next to the classes.
  private void mergeNodeList() throws IOException {
    String listPath = NODE_LIST_DIR + treePackage + ".txt";
    FileObject file = null;
    boolean needsCreate;
    try {
      file = processingEnv.getFiler().getResource(StandardLocation.CLASS_OUTPUT, "", listPath);
      try (BufferedReader br =
          new BufferedReader(
              new InputStreamReader(file.openInputStream(), StandardCharsets.UTF_8))) {
        String line;
        while ((line = br.readLine()) != null) {
          line = line.trim();
          if (!line.isEmpty()) {
            allTreeNodes.add(line);
          }
        }
      }
      needsCreate = false;
    } catch (IOException firstBuild) {
      needsCreate = true;
    }

    if (needsCreate) {
      file = processingEnv.getFiler().createResource(StandardLocation.CLASS_OUTPUT, "", listPath);
    }
    try (Writer wr = file.openWriter()) {
      wr.append(new TreeSet<>(allTreeNodes).stream().collect(Collectors.joining("\n", "", "\n")));
    }
  }

  @FunctionalInterface
  private interface TypeRenderer {
    String renderType(String typeName);
  }

  private void writeFile(String name, String format, TypeRenderer typeRenderer) throws IOException {
    JavaFileObject file = processingEnv.getFiler().createSourceFile(treePackage + "." + name);
    try (Writer wr = file.openWriter()) {
      wr.append(
          String.format(
              format,
              treePackage,
              new TreeSet<>(allTreeNodes)
                  .stream()
                  .map(typeRenderer::renderType)
                  .collect(Collectors.joining("\n\n"))));
    }
  }

  private void generateVisitorFiles() throws IOException {
    mergeNodeList();

    writeFile(
        "TreeVisitor",
        "package %s;\n\ninterface TreeVisitor<V> {\n\n%s\n\n}\n",
        typeName -> String.format("  V visit(%s node, V value);", typeName));
    writeFile(
        "DefaultTreeVisitor",
        "package %s;\n\n"
            + "public abstract class DefaultTreeVisitor<V> implements TreeVisitor<V> {\n\n"
            + "%s\n\n}\n",
        typeName ->
            String.format(
                "  @Override\n"
                    + "  public V visit(%s node, V value) {\n"
                    + "    return node.visitChildren(this, value);\n"
                    + "  }",
                typeName));
    writeFile(
        "VoidDefaultTreeVisitor",
        "package %s;\n\n"
            + "public abstract class VoidDefaultTreeVisitor extends DefaultTreeVisitor<Void> {\n\n"
            + "%s\n\n}\n",
        typeName ->
            String.format(
                "  @Override\n"
                    + "  public final Void visit(%s node, Void value) {\n"
                    + "    visitImpl(node);\n"
                    + "    return null;\n"
                    + "  }\n\n"
                    + "  public void visitImpl(%s node) {\n"
                    + "    node.visitChildren(this, null);\n"
                    + "  }",
                typeName, typeName));
  }

  private static String getTreeNodeInterfaceName(Element element) {
    Deque<String> elems = new ArrayDeque<>();
    elems.push("TreeNode");
    do {
      if (element.getKind() == ElementKind.CLASS) {
        elems.addFirst(element.getSimpleName().toString());
      }
      element = element.getEnclosingElement();
    } while (element.getKind() != ElementKind.PACKAGE);
    return String.join("_", elems);
  }

  private void writeTreeNodeFile(TypeElement element) throws IOException {
    String interfaceName = getTreeNodeInterfaceName(element);
    if (element
        .getInterfaces()
        .stream()
        .noneMatch(i -> TypeName.get(i).toString().endsWith(interfaceName))) {
      processingEnv
          .getMessager()
          .printMessage(Kind.ERROR, "Missing interface: " + interfaceName, element);
      return;
    }

    ClassName nodeInterface = ClassName.get(treePackage, "TreeNodeInterface");
    ClassName visitorName = ClassName.get(treePackage, "TreeVisitor");
    ClassName treeNodesName = ClassName.get(treePackage, "TreeNodes");

    TypeSpec.Builder typeSpecBuilder =
        TypeSpec.interfaceBuilder(interfaceName)
            .addModifiers(Modifier.PUBLIC)
            .addSuperinterface(nodeInterface);

    typeSpecBuilder.addMethod(
        MethodSpec.methodBuilder("accept")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(
                ParameterSpec.builder(ParameterizedTypeName.get(visitorName, V), "visitor")
                    .build())
            .addParameter(ParameterSpec.builder(V, "value").build())
            .addStatement(
                "return visitor.visit(($L) this, value)", element.getQualifiedName().toString())
            .build());

    MethodSpec.Builder visitChildrenMethodBuilder =
        MethodSpec.methodBuilder("visitChildren")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(
                ParameterSpec.builder(ParameterizedTypeName.get(visitorName, V), "visitor")
                    .build())
            .addParameter(ParameterSpec.builder(V, "value").build());
    for (Element maybeMethod : element.getEnclosedElements()) {
      if (maybeMethod.getKind() != ElementKind.METHOD) continue;
      if (maybeMethod.getAnnotation(TreeChild.class) == null) continue;
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
          treeNodesName,
          method.getSimpleName().toString());
    }
    typeSpecBuilder.addMethod(visitChildrenMethodBuilder.addStatement("return value").build());

    JavaFile javaFile = JavaFile.builder(treePackage, typeSpecBuilder.build()).build();
    JavaFileObject file =
        processingEnv.getFiler().createSourceFile(treePackage + "." + interfaceName, element);
    try (Writer wr = file.openWriter()) {
      wr.append(javaFile.toString());
    }
  }

  private boolean claimPackage(TypeElement element) {
    String pkg =
        processingEnv.getElementUtils().getPackageOf(element).getQualifiedName().toString();
    if (treePackage == null) {
      treePackage = pkg;
    } else if (!treePackage.equals(pkg)) {
      processingEnv
          .getMessager()
          .printMessage(
              Kind.ERROR,
              String.format(
                  "@TreeNode classes must share one package, found %s and %s", treePackage, pkg),
              element);
      return false;
    }
    return true;
  }

  private void processImpl(RoundEnvironment roundEnv) throws IOException {
    for (Element element : roundEnv.getElementsAnnotatedWith(TreeNode.class)) {
      TypeElement typeElement = (TypeElement) element;
      if (!claimPackage(typeElement)) continue;

      try {
        writeTreeNodeFile(typeElement);
      } catch (IOException ex) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "APT Error: " + ex, typeElement);
      }

      String extra = "";
      if (!typeElement.getTypeParameters().isEmpty()) {
        extra =
            typeElement
                .getTypeParameters()
                .stream()
                .map(p -> "?")
                .collect(Collectors.joining(", ", "<", ">"));
      }
      allTreeNodes.add(typeElement.getQualifiedName().toString() + extra);
    }
  }
}
