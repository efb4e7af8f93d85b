package com.sfuplan.prereq.repository;

import com.sfuplan.prereq.domain.DomainModels.CatalogCourse;
import com.sfuplan.prereq.parser.PrerequisiteTreeCodec;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class CourseJdbcRepository {
    private static final String COLUMNS =
            "id, dept, course_number, title, description, credits, prerequisites_raw, prerequisites_logic";

    private final JdbcTemplate jdbcTemplate;
    private final PrerequisiteTreeCodec codec;
    private final RowMapper<CatalogCourse> rowMapper;

    public CourseJdbcRepository(JdbcTemplate jdbcTemplate, PrerequisiteTreeCodec codec) {
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
        this.rowMapper = (rs, n) -> new CatalogCourse(
                rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4), rs.getString(5),
                rs.getInt(6), rs.getString(7), codec.decode(rs.getString(8)));
    }

    public void save(CatalogCourse course) {
        jdbcTemplate.update("DELETE FROM courses WHERE id = ?", course.id());
        jdbcTemplate.update(
                "INSERT INTO courses(" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?)",
                course.id(), course.dept(), course.number(), course.title(), course.description(),
                course.credits(), course.prerequisitesRaw(), codec.encode(course.prerequisites()));
    }

    public Optional<CatalogCourse> findById(String courseId) {
        List<CatalogCourse> rows = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM courses WHERE id = ?", rowMapper, courseId);
        return rows.stream().findFirst();
    }

    public List<CatalogCourse> findAll() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM courses ORDER BY dept, course_number", rowMapper);
    }

    public List<RawPrerequisiteRow> loadRawPrerequisites() {
        return jdbcTemplate.query(
                "SELECT id, prerequisites_raw, prerequisites_logic FROM courses ORDER BY id",
                (rs, n) -> new RawPrerequisiteRow(rs.getString(1), rs.getString(2), rs.getString(3)));
    }

    public void updatePrerequisites(String courseId, String logicJson) {
        jdbcTemplate.update("UPDATE courses SET prerequisites_logic = ? WHERE id = ?", logicJson, courseId);
    }

    public void deleteAll() {
        jdbcTemplate.update("DELETE FROM courses");
    }

    public record RawPrerequisiteRow(String courseId, String rawText, String logicJson) {}
}
