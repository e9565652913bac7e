package com.ai.consultas.config;

import com.ai.consultas.entity.Course;
import com.ai.consultas.entity.StaffMember;
import com.ai.consultas.repository.CourseRepository;
import com.ai.consultas.repository.StaffMemberRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Sample courses and staff so a fresh database can serve the selectors.
 */
@Configuration
@ConditionalOnProperty(prefix = "app.registry", name = "seed", havingValue = "true")
public class DataSeeder {

    private static final Logger log = LoggerFactory.getLogger(DataSeeder.class);

    @Bean
    CommandLineRunner seedRegistry(CourseRepository courseRepo, StaffMemberRepository staffRepo) {
        return args -> {
            if (courseRepo.count() > 0 || staffRepo.count() > 0) {
                log.info("Registry already seeded, skipping");
                return;
            }

            List<Course> courses = List.of(
                    course("Cálculo I", "CALC1"),
                    course("Cálculo II", "CALC2"),
                    course("Álgebra Lineal", "ALGLIN"),
                    course("Física I", "FIS1"),
                    course("Física II", "FIS2"),
                    course("Química General", "QUIM1"),
                    course("Programación I", "PROG1"),
                    course("Estadística", "ESTAD"));
            courseRepo.saveAll(courses);

            List<StaffMember> staff = List.of(
                    staff("Luis"),
                    staff("Marta"),
                    staff("Carla"),
                    staff("Andrés"),
                    staff("Sofía"),
                    staff("Diego"));
            staffRepo.saveAll(staff);

            log.info("Seeded {} courses and {} staff members", courses.size(), staff.size());
        };
    }

    private static Course course(String name, String code) {
        return Course.builder().name(name).code(code).active(true).build();
    }

    private static StaffMember staff(String name) {
        return StaffMember.builder().name(name).active(true).build();
    }
}
