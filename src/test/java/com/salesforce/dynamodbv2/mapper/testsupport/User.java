package com.salesforce.dynamodbv2.mapper.testsupport;

import com.salesforce.dynamodbv2.mapper.model.Column;
import com.salesforce.dynamodbv2.mapper.model.Index;
import com.salesforce.dynamodbv2.mapper.model.ModelSchema;
import com.salesforce.dynamodbv2.mapper.model.StreamConfig;
import com.salesforce.dynamodbv2.mapper.types.Types;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Sample model with a hash key, a global index and a stream.
 */
public class User {

    public static final Column<User, String> ID = Column.<User, String>builder("id", Types.string())
        .withAccessors(User::getId, User::setId)
        .withHashKey()
        .build();
    public static final Column<User, String> EMAIL = Column.<User, String>builder("email", Types.string())
        .withAccessors(User::getEmail, User::setEmail)
        .build();
    public static final Column<User, Long> AGE = Column.<User, Long>builder("age", Types.integer())
        .withAccessors(User::getAge, User::setAge)
        .build();
    public static final Column<User, String> NAME = Column.<User, String>builder("name", Types.string())
        .withDynamoName("nm")
        .withAccessors(User::getName, User::setName)
        .build();
    public static final Column<User, Set<String>> TAGS = Column.<User, Set<String>>builder("tags",
        Types.setOf(Types.string()))
        .withAccessors(User::getTags, User::setTags)
        .build();
    public static final Column<User, Map<String, List<Long>>> SCORES = Column.<User, Map<String, List<Long>>>builder(
        "scores", Types.mapOf(Types.listOf(Types.integer())))
        .withAccessors(User::getScores, User::setScores)
        .build();

    public static final ModelSchema<User> SCHEMA = ModelSchema.builder(User.class, User::new)
        .withTableName("user")
        .withColumns(ID, EMAIL, AGE, NAME, TAGS, SCORES)
        .withIndex(Index.globalIndex("by_email", EMAIL).withProjectKeys().build())
        .withStream(StreamConfig.of(StreamConfig.Include.NEW, StreamConfig.Include.OLD))
        .build();

    private String id;
    private String email;
    private Long age;
    private String name;
    private Set<String> tags;
    private Map<String, List<Long>> scores;

    public User() {
    }

    public User(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public Long getAge() {
        return age;
    }

    public void setAge(Long age) {
        this.age = age;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Set<String> getTags() {
        return tags;
    }

    public void setTags(Set<String> tags) {
        this.tags = tags;
    }

    public Map<String, List<Long>> getScores() {
        return scores;
    }

    public void setScores(Map<String, List<Long>> scores) {
        this.scores = scores;
    }

}
