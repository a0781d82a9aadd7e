package sbhackathon.koala.orchestrator.service;

/**
 * 생성기가 빌드한 MCP 서버 이미지를 찾습니다. 이미지 빌드 자체는 이 서비스의 범위가 아닙니다.
 */
public interface McpServerImageResolver {

    /**
     * @param mcpServerId 생성된 MCP 서버 id
     * @return 배포에 사용할 완전한 이미지 참조 (registry/repository:tag)
     */
    String resolve(String mcpServerId);
}
