package gitclone.cli.commands;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

public class CloneCommandTest {

    @Test
    void testHumanishName() {
        assertEquals("repo", CloneCommand.humanishName("https://example.com/group/repo.git"));
        assertEquals("repo", CloneCommand.humanishName("https://example.com/group/repo"));
        assertEquals("repo", CloneCommand.humanishName("https://example.com/group/repo.git/"));
        assertEquals("project", CloneCommand.humanishName("git@example.com:project.git"));
        assertEquals("example.com", CloneCommand.humanishName("https://example.com/"));
    }

    @Test
    void testHumanishNameFallback() {
        assertEquals("repository", CloneCommand.humanishName(".git"));
    }
}
