package accel.asc.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.antlr.runtime.CommonToken;
import org.antlr.runtime.CommonTokenStream;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import accel.asc.ast.AccelAST;
import accel.asc.ast.antlr.AccelScriptParser;
import accel.asc.common.Logging;
import accel.asc.common.Settings;
import accel.asc.common.exceptions.UnsupportedConstructException;
import accel.asc.frontend.tree.Block;
import accel.asc.frontend.tree.FieldList;
import accel.asc.frontend.tree.FieldList.Field;
import accel.asc.frontend.tree.Node;
import accel.asc.frontend.tree.NodeKind;
import accel.asc.frontend.tree.Program;
import accel.asc.frontend.tree.ShaderDeclaration;
import accel.asc.frontend.tree.ShaderDeclaration.Param;
import accel.asc.frontend.tree.ShaderStage;
import accel.asc.frontend.tree.StructDeclaration;

public class TreeBuilderTest {

  private static final String STRUCT_VERTEX =
      "\n" +
      "        struct Vertex {\n" +
      "            position: vec3;\n" +
      "            color: vec3;\n" +
      "        }\n";

  private static final String COMPUTE_ADD =
      "\n" +
      "        compute Add(input1: Buffer<f32>, input2: Buffer<f32>, " +
                        "output: Buffer<f32>) {\n" +
      "            let id = gl_GlobalInvocationID.x;\n" +
      "            output[id] = input1[id] + input2[id];\n" +
      "        }\n";

  private static final String VERTEX_SIMPLE =
      "\n" +
      "        vertex SimpleVertex(vertex: Vertex, uniforms: Uniforms) " +
                        "-> VertexOutput {\n" +
      "            var output: VertexOutput;\n" +
      "            output.position = uniforms.modelViewProj * " +
                        "vec4(vertex.position, 1.0);\n" +
      "            output.color = vertex.color;\n" +
      "            return output;\n" +
      "        }\n";

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/TreeBuilderTest.asc.log", true);
  }

  private static Node build(String source) throws Exception {
    return new TreeBuilder().build(ParsedUnit.parse("test.accel", source));
  }

  @Test
  public void testStructDeclaration() throws Exception {
    Node node = build(STRUCT_VERTEX);

    StructDeclaration struct = node.as(StructDeclaration.class);
    assertNotNull("Should build a struct", struct);
    assertEquals(NodeKind.STRUCT_DECLARATION, struct.getKind());
    assertEquals("StructDeclaration", struct.typeName());
    assertEquals("Vertex", struct.getName());
  }

  @Test
  public void testStructSpan() throws Exception {
    StructDeclaration struct =
        build(STRUCT_VERTEX).as(StructDeclaration.class);

    assertEquals("Span starts at struct keyword",
        STRUCT_VERTEX.indexOf("struct"), struct.getStart());
    assertEquals("Span ends at closing brace",
        STRUCT_VERTEX.lastIndexOf('}'), struct.getEnd());
    assertEquals("Line of struct keyword", 2,
                 struct.getPosition().line);
    assertEquals(8, struct.getPosition().column);
  }

  @Test
  public void testStructFields() throws Exception {
    StructDeclaration struct =
        build(STRUCT_VERTEX).as(StructDeclaration.class);

    FieldList body = struct.getBody();
    assertNotNull("Struct body should be attached", body);
    assertEquals(Arrays.asList(new Field("position", "vec3"),
                               new Field("color", "vec3")),
                 body.getFields());
    assertEquals(STRUCT_VERTEX.indexOf('{'), body.getStart());
    assertEquals(STRUCT_VERTEX.lastIndexOf('}'), body.getEnd());
  }

  @Test
  public void testStructFieldsCommaSeparated() throws Exception {
    StructDeclaration struct = build(
        "struct Light { direction: vec3<f32>, intensity: f32, }")
        .as(StructDeclaration.class);

    List<Field> fields = struct.getBody().getFields();
    assertEquals(2, fields.size());
    assertEquals(new Field("direction", "vec3<f32>"), fields.get(0));
    assertEquals(new Field("intensity", "f32"), fields.get(1));
  }

  @Test
  public void testEmptyStruct() throws Exception {
    StructDeclaration struct = build("struct Empty {}")
                                  .as(StructDeclaration.class);
    assertEquals("Empty", struct.getName());
    assertTrue(struct.getBody().getFields().isEmpty());
    assertEquals(0, struct.getStart());
    assertEquals(14, struct.getEnd());
  }

  @Test
  public void testComputeShader() throws Exception {
    Node node = build(COMPUTE_ADD);

    ShaderDeclaration shader = node.as(ShaderDeclaration.class);
    assertNotNull("Should build a shader", shader);
    assertEquals("computeShaderDeclaration", shader.typeName());
    assertEquals(ShaderStage.COMPUTE, shader.getStage());
    assertEquals("Add", shader.getId());
    assertEquals(3, shader.getParams().size());
    assertEquals(new Param("input1", "Buffer<f32>"),
                 shader.getParams().get(0));
    assertEquals(new Param("input2", "Buffer<f32>"),
                 shader.getParams().get(1));
    assertEquals(new Param("output", "Buffer<f32>"),
                 shader.getParams().get(2));
    assertNull("No return type declared", shader.getReturnType());
    assertFalse(shader.hasReturnType());
  }

  @Test
  public void testVertexShaderWithReturnType() throws Exception {
    Node node = build(VERTEX_SIMPLE);

    ShaderDeclaration shader = node.as(ShaderDeclaration.class);
    assertNotNull(shader);
    assertEquals("vertexShaderDeclaration", shader.typeName());
    assertEquals(ShaderStage.VERTEX, shader.getStage());
    assertEquals("SimpleVertex", shader.getId());
    assertEquals("VertexOutput", shader.getReturnType());
    assertEquals("Keyword is a valid parameter name",
        Arrays.asList(new Param("vertex", "Vertex"),
                      new Param("uniforms", "Uniforms")),
        shader.getParams());
  }

  @Test
  public void testFragmentShader() throws Exception {
    ShaderDeclaration shader = build(
        "fragment Shade(input: VertexOutput) -> vec4<f32> {\n" +
        "  return vec4(input.color, 1.0);\n" +
        "}\n").as(ShaderDeclaration.class);

    assertEquals("fragmentShaderDeclaration", shader.typeName());
    assertEquals(ShaderStage.FRAGMENT, shader.getStage());
    assertEquals("vec4<f32>", shader.getReturnType());
  }

  @Test
  public void testShaderWithoutParameterList() throws Exception {
    ShaderDeclaration shader = build("compute Clear { buffer[0] = 0u; }")
                                      .as(ShaderDeclaration.class);

    assertEquals("Clear", shader.getId());
    assertNotNull("Params should be empty, not absent", shader.getParams());
    assertTrue(shader.getParams().isEmpty());
    assertNull(shader.getReturnType());
  }

  @Test
  public void testShaderWithEmptyParameterList() throws Exception {
    ShaderDeclaration shader = build("compute Clear() {}")
                                      .as(ShaderDeclaration.class);

    assertTrue(shader.getParams().isEmpty());
    assertNull(shader.getReturnType());
  }

  @Test
  public void testShaderSpanAndBody() throws Exception {
    ShaderDeclaration shader = build(COMPUTE_ADD)
                                      .as(ShaderDeclaration.class);

    assertEquals(COMPUTE_ADD.indexOf("compute"), shader.getStart());
    assertEquals(COMPUTE_ADD.lastIndexOf('}'), shader.getEnd());

    Block body = shader.getBody();
    assertNotNull("Body should be kept", body);
    assertEquals("BlockStatement", body.typeName());
    assertEquals(COMPUTE_ADD.indexOf('{'), body.getStart());
    assertEquals(COMPUTE_ADD.lastIndexOf('}'), body.getEnd());
  }

  @Test
  public void testNestedBlocks() throws Exception {
    String source =
        "compute Clamp(data: Buffer<f32>) {\n" +
        "  let i = gl_GlobalInvocationID.x;\n" +
        "  if (data[i] > 1.0) { data[i] = 1.0; } else { data[i] = 0.0; }\n" +
        "}";
    ShaderDeclaration shader = build(source).as(ShaderDeclaration.class);

    assertEquals(source.length() - 1, shader.getEnd());
    assertEquals(source.length() - 1, shader.getBody().getEnd());
  }

  @Test
  public void testTypeTextIsVerbatimTokens() throws Exception {
    ShaderDeclaration shader = build(
        "compute Types(a: Buffer < f32 >, b: array<f32, 4>, c: f32[],\n" +
        "              d: Buffer<Buffer<f32>>, e: mat4x4<f32>[16]) {}")
        .as(ShaderDeclaration.class);

    List<String> types = new ArrayList<String>();
    for (Param p: shader.getParams()) {
      types.add(p.type);
    }
    assertEquals("Whitespace between tokens is not part of type text",
        Arrays.asList("Buffer<f32>", "array<f32,4>", "f32[]",
                      "Buffer<Buffer<f32>>", "mat4x4<f32>[16]"),
        types);
  }

  @Test
  public void testCommentsIgnored() throws Exception {
    ShaderDeclaration shader = build(
        "// leading comment\n" +
        "compute /* stage */ Scale(/* in */ data: Buffer<f32> // trailing\n" +
        "    , factor: f32) {\n" +
        "  data[0] = data[0] * factor; // } not a brace\n" +
        "}").as(ShaderDeclaration.class);

    assertEquals("Scale", shader.getId());
    assertEquals(Arrays.asList(new Param("data", "Buffer<f32>"),
                               new Param("factor", "f32")),
                 shader.getParams());
    assertEquals("Span starts at first token, not comment", 19,
                 shader.getStart());
  }

  @Test
  public void testSpanInvariant() throws Exception {
    String[] sources = { STRUCT_VERTEX, COMPUTE_ADD, VERTEX_SIMPLE,
                         "struct A { x: f32; }" };
    for (String source: sources) {
      Node node = build(source);
      checkSpan(source, node);
    }
  }

  private static void checkSpan(String source, Node node) {
    assertTrue(node + " start", node.getStart() >= 0);
    assertTrue(node + " start <= end", node.getStart() <= node.getEnd());
    assertTrue(node + " end within source",
               node.getEnd() <= source.length() - 1);
  }

  @Test
  public void testBuildIsRepeatable() throws Exception {
    String[] sources = { STRUCT_VERTEX, COMPUTE_ADD, VERTEX_SIMPLE };
    for (String source: sources) {
      Node first = build(source);
      Node second = build(source);
      assertEquals("Identical input should give equal trees",
                   first, second);
      assertEquals(first.hashCode(), second.hashCode());
    }
  }

  @Test
  public void testSameUnitBuiltTwice() throws Exception {
    ParsedUnit unit = ParsedUnit.parse("test.accel", COMPUTE_ADD);
    TreeBuilder builder = new TreeBuilder();
    assertEquals(builder.build(unit), builder.build(unit));
  }

  @Test
  public void testMultipleDeclarationsGiveProgram() throws Exception {
    String source = STRUCT_VERTEX + VERTEX_SIMPLE;
    Node node = build(source);

    Program program = node.as(Program.class);
    assertNotNull("Two declarations should give a program", program);
    assertEquals("Program", program.typeName());
    assertEquals(2, program.getDeclarations().size());
    assertEquals(NodeKind.STRUCT_DECLARATION,
                 program.getDeclarations().get(0).getKind());
    assertEquals(NodeKind.SHADER_DECLARATION,
                 program.getDeclarations().get(1).getKind());
    assertEquals(source.indexOf("struct"), program.getStart());
    assertEquals(source.lastIndexOf('}'), program.getEnd());
    checkSpan(source, program);
  }

  @Test
  public void testEmptyProgram() throws Exception {
    Node node = build("// nothing here\n");

    Program program = node.as(Program.class);
    assertNotNull(program);
    assertTrue(program.getDeclarations().isEmpty());
    assertEquals(0, program.getStart());
    assertEquals(0, program.getEnd());
  }

  @Test
  public void testBuildProgramAlwaysGivesProgram() throws Exception {
    ParsedUnit unit = ParsedUnit.parse("test.accel", STRUCT_VERTEX);
    Program program = new TreeBuilder().buildProgram(unit);

    assertEquals(1, program.getDeclarations().size());
    assertEquals("Single declaration is the same as from build",
        new TreeBuilder().build(unit), program.getDeclarations().get(0));
  }

  @Test
  public void testUnsupportedRoot() throws Exception {
    AccelAST root = new AccelAST(
        new CommonToken(AccelScriptParser.FIELD, "FIELD"));
    ParsedUnit unit = new ParsedUnit("bad.accel", "", new CommonTokenStream(),
                                     root);

    try {
      new TreeBuilder().build(unit);
      fail("Expected UnsupportedConstructException");
    } catch (UnsupportedConstructException e) {
      assertEquals("FIELD", e.getConstructKind());
      assertEquals(AccelScriptParser.FIELD, e.getTokenType());
    }
  }

  @Test
  public void testUnsupportedTopLevelDeclaration() throws Exception {
    ParsedUnit parsed = ParsedUnit.parse("test.accel", STRUCT_VERTEX);
    AccelAST root = parsed.ast;
    root.addChild(new AccelAST(
        new CommonToken(AccelScriptParser.BLOCK, "BLOCK")));

    exception.expect(UnsupportedConstructException.class);
    exception.expectMessage("BLOCK");
    new TreeBuilder().build(parsed);
  }

  @Test
  public void testBuildProgramRejectsDeclarationRoot() throws Exception {
    AccelAST root = new AccelAST(new CommonToken(
          AccelScriptParser.STRUCT_DECLARATION, "STRUCT_DECLARATION"));
    ParsedUnit unit = new ParsedUnit("bad.accel", "", new CommonTokenStream(),
                                     root);

    exception.expect(UnsupportedConstructException.class);
    exception.expectMessage("STRUCT_DECLARATION");
    new TreeBuilder().buildProgram(unit);
  }

  @Test
  public void testDeclarationRootBuildsDirectly() throws Exception {
    ParsedUnit parsed = ParsedUnit.parse("test.accel", VERTEX_SIMPLE);
    ParsedUnit declOnly = new ParsedUnit(parsed.fileName, parsed.source,
                                         parsed.tokens, parsed.ast.child(0));

    assertEquals(new TreeBuilder().build(parsed),
                 new TreeBuilder().build(declOnly));
  }

  @Test
  public void testPrintTreeSetting() throws Exception {
    Settings.set(Settings.PRINT_TREE, "true");
    try {
      Node node = build(STRUCT_VERTEX);
      assertEquals("Vertex", node.as(StructDeclaration.class).getName());
    } finally {
      Settings.reset(Settings.PRINT_TREE);
    }
  }

  @Test
  public void testConcurrentBuilds() throws Exception {
    final TreeBuilder builder = new TreeBuilder();
    final Node expected = builder.build(
                    ParsedUnit.parse("test.accel", VERTEX_SIMPLE));

    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      List<Future<Node>> results = new ArrayList<Future<Node>>();
      for (int i = 0; i < 16; i++) {
        results.add(pool.submit(new Callable<Node>() {
          @Override
          public Node call() throws Exception {
            return builder.build(
                ParsedUnit.parse("test.accel", VERTEX_SIMPLE));
          }
        }));
      }
      for (Future<Node> result: results) {
        Node node = result.get();
        assertEquals(expected, node);
        assertTrue("Each build allocates its own tree", node != expected);
      }
    } finally {
      pool.shutdown();
    }
  }

  @Test
  public void testLookupStruct() throws Exception {
    Program program = build(STRUCT_VERTEX +
        "struct Uniforms { modelViewProj: mat4x4<f32>; }" + VERTEX_SIMPLE)
        .as(Program.class);

    StructDeclaration uniforms = program.lookupStruct("Uniforms");
    assertNotNull(uniforms);
    assertSame(program.getDeclarations().get(1), uniforms);
    assertNull("Shaders are not structs",
               program.lookupStruct("SimpleVertex"));
    assertEquals(2, program.declarationsByKind()
                       .get(NodeKind.STRUCT_DECLARATION).size());
  }
}
