package ungen.scan;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DeclarationScannerTest {

  private SignalTable alu;

  static String readResource(String name) throws IOException {
    try (InputStream in = DeclarationScannerTest.class.getResourceAsStream(name)) {
      Assertions.assertNotNull(in, "missing test resource " + name);
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  @BeforeEach
  void setUp() throws Exception {
    alu = new DeclarationScanner().scan(readResource("/ungen/Alu.v"));
  }

  @Test
  void testWireInitializer() {
    Signal gen12 = alu.getWireAssignment("_GEN_12").orElseThrow();
    Assertions.assertEquals("io_in_a + io_in_b", gen12.rawExpression());
    Assertions.assertEquals(SignalKind.WIRE, gen12.kind());
    Assertions.assertEquals(14, gen12.declarationLine());
    Assertions.assertEquals(14, gen12.assignmentLine());
  }

  @Test
  void testContinuousAssignAfterDeclaration() {
    Signal result = alu.getWireAssignment("result").orElseThrow();
    Assertions.assertEquals("_GEN & mask", result.rawExpression());
    Assertions.assertEquals(17, result.declarationLine());
    Assertions.assertEquals(21, result.assignmentLine());
  }

  @Test
  void testMultiLineAssignIsJoined() {
    Signal gen4 = alu.getWireAssignment("_GEN_4").orElseThrow();
    Assertions.assertEquals("_GEN_13[3:0] ^ {2{io_op}}", gen4.rawExpression());
    Assertions.assertEquals(22, gen4.assignmentLine());
    Assertions.assertTrue(alu.getAssignmentAt(23).isEmpty());
    Assertions.assertTrue(alu.getAssignmentAt(24).isEmpty());
  }

  @Test
  void testRegisterAssignmentsKeepEverySite() {
    List<Signal> acc = alu.getRegisterAssignments("acc");
    Assertions.assertEquals(2, acc.size());
    Assertions.assertEquals("8'h0", acc.get(0).rawExpression());
    Assertions.assertEquals(29, acc.get(0).assignmentLine());
    Assertions.assertEquals("result", acc.get(1).rawExpression());
    Assertions.assertEquals(31, acc.get(1).assignmentLine());
    Assertions.assertEquals(25, acc.get(1).declarationLine());
    Assertions.assertTrue(alu.getWireAssignment("acc").isEmpty());
  }

  @Test
  void testPortsAreDeclarations() {
    Declaration ioIn = alu.getDeclaration("io_in_a").orElseThrow();
    Assertions.assertEquals(SignalKind.WIRE, ioIn.kind());
    Assertions.assertEquals(Optional.of("input"), ioIn.direction());
    Assertions.assertEquals(Optional.of("[7:0]"), ioIn.range());
    Assertions.assertEquals(5, ioIn.line());
    Assertions.assertEquals(Optional.of("output"), alu.getDeclaration("io_zero").orElseThrow().direction());
    Assertions.assertEquals(Optional.empty(), alu.getDeclaration("clock").orElseThrow().range());
  }

  @Test
  void testKinds() {
    Assertions.assertEquals(Optional.of(SignalKind.REG), alu.getKind("_GEN_20"));
    Assertions.assertEquals(Optional.of(SignalKind.WIRE), alu.getKind("io_out"));
    Assertions.assertEquals(Optional.empty(), alu.getKind("posedge"));
    Assertions.assertFalse(alu.contains("block"));
  }

  @Test
  void testCommentsDoNotShiftLines() {
    // the block comment spans lines 19-20
    Assertions.assertEquals(21, alu.getWireAssignment("result").orElseThrow().assignmentLine());
    Assertions.assertEquals(37, alu.getLineCount());
  }

  @Test
  void testAssignmentsByLineAreOrdered() {
    List<Integer> lines = alu.streamAssignments().map(Signal::assignmentLine).toList();
    Assertions.assertEquals(List.of(14, 15, 16, 21, 22, 29, 31, 33, 35, 36), lines);
  }

  @Test
  void testProceduralPrefixes() throws Exception {
    String src = "always @(posedge clock) r0 <= a;\n"
                 + "if (reset) r1 <= 1'h0;\n"
                 + "end else if (io_en & (io_x | io_y)) begin r2 <= b;\n"
                 + "else r3 <= c;\n";
    SignalTable table = new DeclarationScanner().scan(src);
    Assertions.assertEquals("a", table.getAssignmentAt(1).orElseThrow().rawExpression());
    Assertions.assertEquals("r1", table.getAssignmentAt(2).orElseThrow().name());
    Assertions.assertEquals("b", table.getAssignmentAt(3).orElseThrow().rawExpression());
    Assertions.assertEquals("c", table.getAssignmentAt(4).orElseThrow().rawExpression());
    Assertions.assertEquals(SignalKind.REG, table.getAssignmentAt(4).orElseThrow().kind());
  }

  @Test
  void testSeveralStatementsOnOneLine() throws Exception {
    SignalTable table = new DeclarationScanner().scan("wire _GEN_1 = a; wire _GEN_2 = b;\n"
                                                      + "wire x; assign x = _GEN_1 |\n  _GEN_2; assign y = x;\n"
                                                      + "if (reset) r <= 1'h0; else r <= d;\n");
    Assertions.assertEquals("a", table.getWireAssignment("_GEN_1").orElseThrow().rawExpression());
    Assertions.assertEquals("b", table.getWireAssignment("_GEN_2").orElseThrow().rawExpression());
    Assertions.assertEquals(1, table.getWireAssignment("_GEN_2").orElseThrow().assignmentLine());
    Assertions.assertEquals(SignalKind.WIRE, table.getDeclaration("x").orElseThrow().kind());
    Assertions.assertEquals("_GEN_1 | _GEN_2", table.getWireAssignment("x").orElseThrow().rawExpression());
    // a statement after a multi-line one starts on the line where the other one ended
    Assertions.assertEquals(3, table.getWireAssignment("y").orElseThrow().assignmentLine());
    Assertions.assertEquals(List.of("1'h0", "d"), table.getRegisterAssignments("r").stream().map(Signal::rawExpression).toList());
    // a line lookup finds the first statement starting there
    Assertions.assertEquals("_GEN_1", table.getAssignmentAt(1).orElseThrow().name());
    Assertions.assertEquals(6, table.getAssignmentCount());
    Assertions.assertThrows(ScanException.class, () -> new DeclarationScanner().scan("wire a = b; assign c = d"));
  }

  @Test
  void testIgnoredConstructs() throws Exception {
    String src = "`ifdef SYNTHESIS\n"
                 + "assign mem_x[3] = a;\n"
                 + "mem[addr] <= data;\n"
                 + "Sub sub (.clock(clock));\n"
                 + "case (state)\n"
                 + "`endif\n"
                 + "assign y = \"//not a comment\";\n";
    SignalTable table = new DeclarationScanner().scan(src);
    Assertions.assertEquals(1, table.getAssignmentCount());
    Assertions.assertEquals("\"//not a comment\"", table.getWireAssignment("y").orElseThrow().rawExpression());
  }

  @Test
  void testMultipleDeclarators() throws Exception {
    SignalTable table = new DeclarationScanner().scan("wire a, b;\nreg [3:0] mem [0:15];\nwire signed [7:0] s;\n");
    Assertions.assertEquals(1, table.getDeclaration("b").orElseThrow().line());
    Assertions.assertEquals(2, table.getDeclaration("mem").orElseThrow().line());
    Assertions.assertEquals(SignalKind.REG, table.getDeclaration("mem").orElseThrow().kind());
    Assertions.assertEquals(Optional.of("[7:0]"), table.getDeclaration("s").orElseThrow().range());
  }

  @Test
  void testPortRedeclaration() throws Exception {
    SignalTable table = new DeclarationScanner().scan("output [3:0] q;\nreg q;\nalways @(posedge clk) q <= d;\n");
    Declaration q = table.getDeclaration("q").orElseThrow();
    Assertions.assertEquals(SignalKind.REG, q.kind());
    Assertions.assertEquals(Optional.of("[3:0]"), q.range());
    Assertions.assertTrue(q.isPort());
  }

  @Test
  void testRegInitializerIsNotAnAssignment() throws Exception {
    SignalTable table = new DeclarationScanner().scan("reg [1:0] state = 2'h0;\n");
    Assertions.assertEquals(0, table.getAssignmentCount());
    Assertions.assertEquals(SignalKind.REG, table.getDeclaration("state").orElseThrow().kind());
  }

  @Test
  void testDuplicateWireAssignment() {
    var e = Assertions.assertThrows(ScanException.class,
                                    () -> new DeclarationScanner().scan("wire x = a;\nassign x = b;\n"));
    Assertions.assertEquals(2, e.getLine());
    Assertions.assertTrue(e.getMessage().contains("duplicate assignment"), e.getMessage());
  }

  @ParameterizedTest
  @ValueSource(strings = {"assign x = a",            // unterminated
                          "assign = a;",             // no target
                          "assign x == a;",          // not an assignment
                          "assign x = ;",            // empty right-hand side
                          "wire 3x;",                // bad identifier
                          "wire x;\nwire x;",        // redeclaration
                          "reg r;\nassign r = a;",   // continuous assignment to reg
                          "wire w;\nw <= a;",        // procedural assignment to wire
                          "assign z = a;\nz <= b;"}) // mixed assignment kinds
  void testScanErrors(String src) {
    Assertions.assertThrows(ScanException.class, () -> new DeclarationScanner().scan(src));
  }

  @Test
  void testStripComments() {
    Assertions.assertEquals("a" + " ".repeat(4) + "\nb", DeclarationScanner.stripComments("a //x\nb"));
    Assertions.assertEquals("a" + " ".repeat(5) + "\n" + " ".repeat(4) + "b", DeclarationScanner.stripComments("a /* x\n */ b"));
  }
}
