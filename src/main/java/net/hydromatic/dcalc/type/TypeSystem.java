/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.dcalc.type;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.dcalc.ast.Pos;
import net.hydromatic.dcalc.compile.CompileException;

/**
 * Declaration context: the structs and enumerations of a program, and a
 * factory for types.
 *
 * <p>Structs and enumerations are kept in declaration order; so are the
 * fields of a struct and the constructors of an enumeration.
 */
public class TypeSystem {
  /** Name of the "None" constructor of the option enumeration. */
  public static final String NONE = "None";

  /** Name of the "Some" constructor of the option enumeration. */
  public static final String SOME = "Some";

  private final Map<String, ImmutableMap<String, Type>> structs =
      new LinkedHashMap<>();
  private final Map<String, ImmutableMap<String, Type>> enums =
      new LinkedHashMap<>();
  private final Map<String, Pos> structPositions = new HashMap<>();
  private final Map<String, Pos> enumPositions = new HashMap<>();

  /** Creates an empty TypeSystem. */
  public TypeSystem() {}

  /** Creates a TypeSystem with the same declarations as another. */
  private TypeSystem(TypeSystem typeSystem) {
    structs.putAll(typeSystem.structs);
    enums.putAll(typeSystem.enums);
    structPositions.putAll(typeSystem.structPositions);
    enumPositions.putAll(typeSystem.enumPositions);
  }

  /** Creates a function type. */
  public FnType fnType(List<? extends Type> paramTypes, Type resultType) {
    checkArgument(!paramTypes.isEmpty(), "function must have a parameter");
    return new FnType(paramTypes, resultType);
  }

  /** Creates a function type with one parameter. */
  public FnType fnType(Type paramType, Type resultType) {
    return fnType(ImmutableList.of(paramType), resultType);
  }

  /** Creates a thunk type, {@code unit -> resultType}. */
  public FnType thunkType(Type resultType) {
    return fnType(PrimitiveType.UNIT, resultType);
  }

  /** Creates a tuple type. */
  public TupleType tupleType(List<? extends Type> argTypes) {
    return new TupleType(argTypes);
  }

  /** Creates a tuple type. */
  public TupleType tupleType(Type argType0, Type... argTypes) {
    return tupleType(ImmutableList.<Type>builder().add(argType0)
        .add(argTypes).build());
  }

  /** Creates an array type. */
  public ArrayType arrayType(Type elementType) {
    return new ArrayType(elementType);
  }

  /** Creates an option type. */
  public OptionType optionType(Type elementType) {
    return new OptionType(elementType);
  }

  /** Declares a struct, and returns its type. */
  public StructType structType(String name, Map<String, ? extends Type> fields) {
    return structType(Pos.ZERO, name, fields);
  }

  /** Declares a struct at a given position, and returns its type. */
  public StructType structType(Pos pos, String name,
      Map<String, ? extends Type> fields) {
    checkArgument(!structs.containsKey(name), "duplicate struct %s", name);
    structs.put(name, ImmutableMap.copyOf(fields));
    structPositions.put(name, pos);
    return new StructType(name);
  }

  /** Declares an enumeration, and returns its type. */
  public EnumType enumType(String name, Map<String, ? extends Type> constructors) {
    return enumType(Pos.ZERO, name, constructors);
  }

  /** Declares an enumeration at a given position, and returns its type. */
  public EnumType enumType(Pos pos, String name,
      Map<String, ? extends Type> constructors) {
    checkArgument(!enums.containsKey(name), "duplicate enum %s", name);
    checkArgument(!constructors.isEmpty(), "enum %s has no constructors", name);
    enums.put(name, ImmutableMap.copyOf(constructors));
    enumPositions.put(name, pos);
    return new EnumType(name);
  }

  /** Returns the position where a struct is declared, or {@link Pos#ZERO}
   * if it is not known. */
  public Pos structPos(String name) {
    return structPositions.getOrDefault(name, Pos.ZERO);
  }

  /** Returns the position where an enumeration is declared, or
   * {@link Pos#ZERO} if it is not known. */
  public Pos enumPos(String name) {
    return enumPositions.getOrDefault(name, Pos.ZERO);
  }

  /** Returns the type of a declared struct. */
  public StructType lookupStruct(String name) {
    fields(name);
    return new StructType(name);
  }

  /** Returns the type of a declared enumeration. */
  public EnumType lookupEnum(String name) {
    constructors(name);
    return new EnumType(name);
  }

  /** Returns whether a struct is declared. */
  public boolean hasStruct(String name) {
    return structs.containsKey(name);
  }

  /** Returns whether an enumeration is declared. */
  public boolean hasEnum(String name) {
    return enums.containsKey(name);
  }

  /** Returns the names of the declared structs. */
  public Set<String> structNames() {
    return structs.keySet();
  }

  /** Returns the names of the declared enumerations. */
  public Set<String> enumNames() {
    return enums.keySet();
  }

  /** Returns the fields of a struct, in declaration order. */
  public ImmutableMap<String, Type> fields(String structName) {
    final ImmutableMap<String, Type> fields = structs.get(structName);
    if (fields == null) {
      throw CompileException.internal(Pos.ZERO, "unknown struct %s",
          structName);
    }
    return fields;
  }

  /** Returns the type of a field of a struct. */
  public Type fieldType(String structName, String field) {
    final Type type = fields(structName).get(field);
    if (type == null) {
      throw CompileException.internal(Pos.ZERO, "unknown field %s of struct %s",
          field, structName);
    }
    return type;
  }

  /** Returns the constructors of an enumeration, in declaration order. */
  public ImmutableMap<String, Type> constructors(String enumName) {
    final ImmutableMap<String, Type> constructors = enums.get(enumName);
    if (constructors == null) {
      throw CompileException.internal(Pos.ZERO, "unknown enum %s", enumName);
    }
    return constructors;
  }

  /** Returns the payload type of a constructor of an enumeration. */
  public Type constructorType(String enumName, String constructor) {
    final Type type = constructors(enumName).get(constructor);
    if (type == null) {
      throw CompileException.internal(Pos.ZERO,
          "unknown constructor %s of enum %s", constructor, enumName);
    }
    return type;
  }

  /**
   * Translates a type of the default calculus to the corresponding type of
   * the lambda calculus with options.
   *
   * <p>A thunk type {@code unit -> t} becomes {@code t option}; function,
   * tuple and array types are translated component-wise; other types are
   * unchanged.
   */
  public Type translate(Type type) {
    switch (type.op()) {
      case OPTION_TYPE:
        throw CompileException.internal(Pos.ZERO,
            "option type %s in the default calculus", type);
      case FUNCTION_TYPE:
        if (type.isThunk()) {
          return optionType(translate(((FnType) type).resultType));
        }
        // fall through
      default:
        return type.copy(this, this::translate);
    }
  }

  /**
   * Creates the declaration context of a translated program.
   *
   * <p>It has the same declarations as this context, plus the option
   * enumeration, and the field types of the given input structs are
   * translated.
   */
  public TypeSystem translateDeclarations(Collection<String> inputStructs,
      String optionEnum) {
    if (enums.containsKey(optionEnum)) {
      throw CompileException.internal(Pos.ZERO,
          "enum %s is already declared", optionEnum);
    }
    final TypeSystem typeSystem = new TypeSystem(this);
    for (String inputStruct : inputStructs) {
      final Map<String, Type> fields = new LinkedHashMap<>();
      fields(inputStruct).forEach((name, type) ->
          fields.put(name, translate(type)));
      typeSystem.structs.put(inputStruct, ImmutableMap.copyOf(fields));
    }
    typeSystem.enumType(optionEnum,
        ImmutableMap.of(NONE, PrimitiveType.UNIT, SOME, DummyType.INSTANCE));
    return typeSystem;
  }
}

// End TypeSystem.java
