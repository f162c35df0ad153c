package me.christianrobert.ast2c.generator.builder;

import me.christianrobert.ast2c.tree.parser.AstJsonReader;
import me.christianrobert.ast2c.tree.parser.ParseResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Whole programs, read from JSON dumps shaped the way pycparser's to-dict export writes them
 * (including qualifiers, coordinates and other fields the generator ignores).
 */
class ExampleProgramGenerationTest {

    private AstJsonReader reader;
    private CCodeBuilder builder;

    @BeforeEach
    void setUp() {
        reader = new AstJsonReader();
        builder = new CCodeBuilder();
    }

    private String generate(String json) {
        ParseResult result = reader.read(json);
        assertTrue(result.isSuccess(), () -> "Read failed: " + result.getErrorMessage());
        return builder.generate(result.getTree());
    }

    @Test
    void addFunction() {
        String json = """
                {
                  "_nodetype": "FileAST",
                  "coord": null,
                  "ext": [
                    {
                      "_nodetype": "FuncDef",
                      "coord": "add.c:1:5",
                      "decl": {
                        "_nodetype": "Decl",
                        "name": "add",
                        "quals": [],
                        "storage": [],
                        "funcspec": [],
                        "coord": "add.c:1:5",
                        "type": {
                          "_nodetype": "FuncDecl",
                          "coord": "add.c:1:5",
                          "args": {
                            "_nodetype": "ParamList",
                            "coord": "add.c:1:13",
                            "params": [
                              {
                                "_nodetype": "Decl",
                                "name": "a",
                                "quals": [],
                                "storage": [],
                                "funcspec": [],
                                "coord": "add.c:1:13",
                                "type": {
                                  "_nodetype": "TypeDecl",
                                  "declname": "a",
                                  "quals": [],
                                  "coord": "add.c:1:13",
                                  "type": {"_nodetype": "IdentifierType", "names": ["int"], "coord": "add.c:1:9"}
                                },
                                "init": null,
                                "bitsize": null
                              },
                              {
                                "_nodetype": "Decl",
                                "name": "b",
                                "quals": [],
                                "storage": [],
                                "funcspec": [],
                                "coord": "add.c:1:20",
                                "type": {
                                  "_nodetype": "TypeDecl",
                                  "declname": "b",
                                  "quals": [],
                                  "coord": "add.c:1:20",
                                  "type": {"_nodetype": "IdentifierType", "names": ["int"], "coord": "add.c:1:16"}
                                },
                                "init": null,
                                "bitsize": null
                              }
                            ]
                          },
                          "type": {
                            "_nodetype": "TypeDecl",
                            "declname": "add",
                            "quals": [],
                            "coord": "add.c:1:5",
                            "type": {"_nodetype": "IdentifierType", "names": ["int"], "coord": "add.c:1:1"}
                          }
                        },
                        "init": null,
                        "bitsize": null
                      },
                      "param_decls": null,
                      "body": {
                        "_nodetype": "Compound",
                        "coord": "add.c:2:1",
                        "block_items": [
                          {
                            "_nodetype": "Return",
                            "coord": "add.c:3:5",
                            "expr": {
                              "_nodetype": "BinaryOp",
                              "op": "+",
                              "coord": "add.c:3:12",
                              "left": {"_nodetype": "ID", "name": "a", "coord": "add.c:3:12"},
                              "right": {"_nodetype": "ID", "name": "b", "coord": "add.c:3:16"}
                            }
                          }
                        ]
                      }
                    }
                  ]
                }
                """;

        assertEquals("int add(int a, int b)\n{\n    return (a + b);\n}", generate(json));
    }

    @Test
    void programWithGlobalsPrototypeLoopAndBranches() {
        String json = """
                {
                  "_nodetype": "FileAST",
                  "ext": [
                    {
                      "_nodetype": "Decl",
                      "name": "counter",
                      "quals": [],
                      "storage": [],
                      "type": {
                        "_nodetype": "TypeDecl",
                        "declname": "counter",
                        "quals": [],
                        "type": {"_nodetype": "IdentifierType", "names": ["int"]}
                      },
                      "init": {"_nodetype": "Constant", "type": "int", "value": "0"},
                      "bitsize": null
                    },
                    {
                      "_nodetype": "Decl",
                      "name": "dup",
                      "quals": [],
                      "storage": [],
                      "type": {
                        "_nodetype": "FuncDecl",
                        "args": {
                          "_nodetype": "ParamList",
                          "params": [
                            {
                              "_nodetype": "Decl",
                              "name": "s",
                              "type": {
                                "_nodetype": "PtrDecl",
                                "quals": [],
                                "type": {
                                  "_nodetype": "TypeDecl",
                                  "declname": "s",
                                  "quals": [],
                                  "type": {"_nodetype": "IdentifierType", "names": ["char"]}
                                }
                              },
                              "init": null
                            }
                          ]
                        },
                        "type": {
                          "_nodetype": "PtrDecl",
                          "quals": [],
                          "type": {
                            "_nodetype": "TypeDecl",
                            "declname": "dup",
                            "quals": [],
                            "type": {"_nodetype": "IdentifierType", "names": ["char"]}
                          }
                        }
                      },
                      "init": null
                    },
                    {
                      "_nodetype": "FuncDef",
                      "decl": {
                        "_nodetype": "Decl",
                        "name": "main",
                        "type": {
                          "_nodetype": "FuncDecl",
                          "args": {
                            "_nodetype": "ParamList",
                            "params": [
                              {
                                "_nodetype": "Decl",
                                "name": "argc",
                                "type": {
                                  "_nodetype": "TypeDecl",
                                  "declname": "argc",
                                  "type": {"_nodetype": "IdentifierType", "names": ["int"]}
                                },
                                "init": null
                              },
                              {
                                "_nodetype": "Decl",
                                "name": "argv",
                                "type": {
                                  "_nodetype": "PtrDecl",
                                  "type": {
                                    "_nodetype": "PtrDecl",
                                    "type": {
                                      "_nodetype": "TypeDecl",
                                      "declname": "argv",
                                      "type": {"_nodetype": "IdentifierType", "names": ["char"]}
                                    }
                                  }
                                },
                                "init": null
                              }
                            ]
                          },
                          "type": {
                            "_nodetype": "TypeDecl",
                            "declname": "main",
                            "type": {"_nodetype": "IdentifierType", "names": ["int"]}
                          }
                        },
                        "init": null
                      },
                      "param_decls": null,
                      "body": {
                        "_nodetype": "Compound",
                        "block_items": [
                          {
                            "_nodetype": "Decl",
                            "name": "i",
                            "type": {
                              "_nodetype": "TypeDecl",
                              "declname": "i",
                              "type": {"_nodetype": "IdentifierType", "names": ["int"]}
                            },
                            "init": {"_nodetype": "Constant", "type": "int", "value": "0"}
                          },
                          {
                            "_nodetype": "While",
                            "cond": {
                              "_nodetype": "BinaryOp",
                              "op": "<",
                              "left": {"_nodetype": "ID", "name": "i"},
                              "right": {"_nodetype": "ID", "name": "argc"}
                            },
                            "stmt": {
                              "_nodetype": "Compound",
                              "block_items": [
                                {
                                  "_nodetype": "If",
                                  "cond": {
                                    "_nodetype": "BinaryOp",
                                    "op": "==",
                                    "left": {"_nodetype": "ID", "name": "i"},
                                    "right": {"_nodetype": "Constant", "type": "int", "value": "1"}
                                  },
                                  "iftrue": {
                                    "_nodetype": "Compound",
                                    "block_items": [
                                      {
                                        "_nodetype": "FuncCall",
                                        "name": {"_nodetype": "ID", "name": "puts"},
                                        "args": {
                                          "_nodetype": "ExprList",
                                          "exprs": [
                                            {
                                              "_nodetype": "ArrayRef",
                                              "name": {"_nodetype": "ID", "name": "argv"},
                                              "subscript": {"_nodetype": "Constant", "type": "int", "value": "1"}
                                            }
                                          ]
                                        }
                                      }
                                    ]
                                  },
                                  "iffalse": null
                                },
                                {
                                  "_nodetype": "Assignment",
                                  "op": "+=",
                                  "lvalue": {"_nodetype": "ID", "name": "i"},
                                  "rvalue": {"_nodetype": "Constant", "type": "int", "value": "1"}
                                }
                              ]
                            }
                          },
                          {
                            "_nodetype": "If",
                            "cond": {
                              "_nodetype": "BinaryOp",
                              "op": ">",
                              "left": {"_nodetype": "ID", "name": "counter"},
                              "right": {"_nodetype": "Constant", "type": "int", "value": "0"}
                            },
                            "iftrue": {"_nodetype": "Return", "expr": {"_nodetype": "Constant", "type": "int", "value": "1"}},
                            "iffalse": {"_nodetype": "Return", "expr": {"_nodetype": "Constant", "type": "int", "value": "0"}}
                          }
                        ]
                      }
                    }
                  ]
                }
                """;

        String expected = """
                int counter = 0;

                char *dup(char *s);

                int main(int argc, char **argv)
                {
                    int i = 0;
                    while ((i < argc))
                    {
                        if ((i == 1))
                        {
                            puts(argv[1]);
                        }
                        i += 1;
                    }
                    if ((counter > 0)) return 1; else return 0;
                }""";

        assertEquals(expected, generate(json));
    }

    @Test
    void voidPrototypeAndGlobalString() {
        String json = """
                {"_nodetype": "FileAST", "ext": [
                  {"_nodetype": "Decl", "name": "run",
                   "type": {"_nodetype": "FuncDecl", "args": null,
                            "type": {"_nodetype": "TypeDecl", "declname": "run",
                                     "type": {"_nodetype": "IdentifierType", "names": ["void"]}}},
                   "init": null},
                  {"_nodetype": "Decl", "name": "greeting",
                   "type": {"_nodetype": "PtrDecl",
                            "type": {"_nodetype": "TypeDecl", "declname": "greeting",
                                     "type": {"_nodetype": "IdentifierType", "names": ["char"]}}},
                   "init": {"_nodetype": "Constant", "type": "string", "value": "\\"hi\\""}}
                ]}
                """;

        assertEquals("void run(void);\n\nchar *greeting = \"hi\";", generate(json));
    }

    @Test
    void unsupportedStatementsDoNotAbortTheProgram() {
        // break has no rule of its own and renders as an empty line
        String json = """
                {"_nodetype": "FileAST", "ext": [
                  {"_nodetype": "FuncDef",
                   "decl": {"_nodetype": "Decl", "name": "f",
                            "type": {"_nodetype": "FuncDecl", "args": null,
                                     "type": {"_nodetype": "TypeDecl", "declname": "f",
                                              "type": {"_nodetype": "IdentifierType", "names": ["void"]}}}},
                   "body": {"_nodetype": "Compound", "block_items": [
                     {"_nodetype": "Break", "coord": "f.c:3:9"},
                     {"_nodetype": "Return", "expr": null}
                   ]}}
                ]}
                """;

        String code = generate(json);

        assertTrue(code.startsWith("void f(void)\n{\n"));
        assertTrue(code.endsWith("    return;\n}"));
    }
}
