package com.restschema.server.demo;

import com.google.common.base.MoreObjects;
import java.util.Objects;

/** A cat of the demo API; a plain mutable bean written through its setters. */
public class Cat {
  private int id;
  private String name;
  private String breed;
  private Integer age;

  public Cat() {}

  public Cat(int id, String name, String breed, Integer age) {
    this.id = id;
    this.name = name;
    this.breed = breed;
    this.age = age;
  }

  public int getId() {
    return id;
  }

  void setId(int id) {
    this.id = id;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getBreed() {
    return breed;
  }

  public void setBreed(String breed) {
    this.breed = breed;
  }

  public Integer getAge() {
    return age;
  }

  public void setAge(Integer age) {
    this.age = age;
  }

  Cat copy() {
    return new Cat(id, name, breed, age);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Cat)) {
      return false;
    }
    Cat other = (Cat) obj;
    return id == other.id
        && Objects.equals(name, other.name)
        && Objects.equals(breed, other.breed)
        && Objects.equals(age, other.age);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, name, breed, age);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("name", name)
        .add("breed", breed)
        .add("age", age)
        .toString();
  }
}
