package com.ai.consultas.component;

import org.springframework.stereotype.Component;

import com.ai.consultas.conversation.FormRecord;

@Component
public class ResponsePhrases {

    public String help() {
        return "¡Hola! Soy el ayudante virtual de Geconsultas 🙂\n"
                + "Conmigo puedes ingresar los datos de tu Geconsulta de forma automatizada, sin rollos 😎\n"
                + "➡️ Usa el comando /auth para autenticar tu chat 🔐\n"
                + "➡️ Usa el comando /registrar para ingresar datos 📝\n"
                + "➡️ Usa el comando /restart para borrar los datos y comenzar desde cero 🔄\n"
                + "➡️ Usa el comando /logout para cerrar tu sesión 👋";
    }

    public String askPassword() {
        return "Por favor, introduce la contraseña 🙂";
    }

    public String authCompleted() {
        return "¡Autenticación completa! 😎 Ahora puedes usar /registrar para comenzar la entrada de datos.";
    }

    public String authRetry() {
        return "Contraseña inválida, por favor intenta nuevamente.";
    }

    public String alreadyAuthenticated() {
        return "Parece que ya estás autenticado 🙂\n"
                + "Para registrar tu consulta, usa el comando /registrar 📝";
    }

    public String authRequired() {
        return "Por favor, usa el comando /auth para autenticar tu chat primero ✅";
    }

    public String loggedOut() {
        return "Sesión cerrada con éxito 🙂 ¡Nos vemos! Usa /start para volver a comenzar.";
    }

    public String dataReset() {
        return "¡Datos reseteados!";
    }

    public String registerIntro() {
        return "Por favor, sigue los pasos para registrar tu consulta 🙂";
    }

    public String askStudentName() {
        return "Introduce el nombre del estudiante 📖⬇️";
    }

    public String invalidStudentName() {
        return "Parece que no enviaste un nombre válido 🤔\n"
                + "Por favor, inténtalo de nuevo 👇";
    }

    public String selectCourse() {
        return "¡Genial! Ahora selecciona la materia ☺️";
    }

    public String selectAssistant() {
        return "¿Quién atendió la consulta? 👩‍🏫";
    }

    public String selectAuxiliary() {
        return "¿Quién fue el miembro de soporte? 🤝";
    }

    public String selectReceivedDate() {
        return "¿Cuándo se recibió la consulta? 📥";
    }

    public String selectStartDate() {
        return "¿Cuándo comenzó la atención? ⏱️";
    }

    public String selectEndDate() {
        return "¿Cuándo terminó la consulta? ✅";
    }

    public String useButtons() {
        return "Por favor, usa los botones del mensaje anterior para elegir una opción 👆";
    }

    public String dataUnavailable() {
        return "No pude obtener las opciones en este momento 😕\n"
                + "Envía cualquier mensaje para intentarlo de nuevo, o usa /restart.";
    }

    public String recordSaved() {
        return "¡Consulta registrada con éxito! 🎉";
    }

    public String recordSummary(FormRecord record) {
        return "📝 Estudiante: " + record.getStudentName() + "\n"
                + "📚 Materia: " + record.getCourseName() + "\n"
                + "👩‍🏫 Encargado: " + record.getAssistantName() + "\n"
                + "🤝 Soporte: " + record.getAuxiliaryName() + "\n"
                + "📥 Recibida: " + record.getReceivedDate() + "\n"
                + "⏱️ Atendida: " + record.getStartDate() + "\n"
                + "✅ Completada: " + record.getEndDate();
    }

    public String registerAnother() {
        return "Usa /registrar para ingresar otra consulta 🙂";
    }
}
